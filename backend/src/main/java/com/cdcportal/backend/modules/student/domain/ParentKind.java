package com.cdcportal.backend.modules.student.domain;

public enum ParentKind {
    MOTHER,
    FATHER
}
