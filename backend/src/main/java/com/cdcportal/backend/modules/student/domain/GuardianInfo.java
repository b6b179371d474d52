package com.cdcportal.backend.modules.student.domain;

import com.cdcportal.backend.global.jpa.AbstractTimestampedEntity;
import com.cdcportal.backend.modules.account.domain.UserAccount;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;

/**
 * Guardian of a student. {@code guardianUser} links a parent account to the child;
 * a parent account is linked to at most one child.
 */
@Entity
@Table(name = "guardian_info")
public class GuardianInfo extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "student_id", nullable = false, unique = true, updatable = false)
    private Student student;

    @Column(name = "guardian_name", nullable = false, length = 150)
    private String guardianName;

    @Column(name = "relationship", length = 50)
    private String relationship;

    @Column(name = "email", length = 150)
    private String email;

    @Column(name = "contact_number", length = 30)
    private String contactNumber;

    @Column(name = "address", length = 500)
    private String address;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "guardian_user_id", unique = true)
    private UserAccount guardianUser;

    protected GuardianInfo() {
    }

    public GuardianInfo(Student student, String guardianName) {
        this.student = student;
        this.guardianName = guardianName;
    }

    public Long getId() {
        return id;
    }

    public Student getStudent() {
        return student;
    }

    public String getGuardianName() {
        return guardianName;
    }

    public String getRelationship() {
        return relationship;
    }

    public void setRelationship(String relationship) {
        this.relationship = relationship;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getContactNumber() {
        return contactNumber;
    }

    public void setContactNumber(String contactNumber) {
        this.contactNumber = contactNumber;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public UserAccount getGuardianUser() {
        return guardianUser;
    }

    public void setGuardianUser(UserAccount guardianUser) {
        this.guardianUser = guardianUser;
    }
}
