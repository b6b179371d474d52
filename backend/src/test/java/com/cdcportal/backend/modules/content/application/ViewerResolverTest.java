package com.cdcportal.backend.modules.content.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.time.LocalDate;
import java.util.Optional;

import com.cdcportal.backend.modules.access.domain.Actor;
import com.cdcportal.backend.modules.account.domain.UserRoleType;
import com.cdcportal.backend.modules.content.domain.Viewer;
import com.cdcportal.backend.modules.student.infrastructure.persistence.StudentRepository;
import com.cdcportal.backend.modules.tenant.domain.Tenant;
import com.cdcportal.backend.modules.tenant.domain.TenantStatus;
import com.cdcportal.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ViewerResolverTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 1, 10);
    private static final Actor PARENT = new Actor(30L, UserRoleType.PARENT, 7L, TenantStatus.ACTIVE, 2L, null);

    @Mock
    private StudentRepository studentRepository;

    private ViewerResolver viewerResolver;
    private Tenant lian;

    @BeforeEach
    void setUp() {
        viewerResolver = new ViewerResolver(studentRepository);
        lian = TestEntities.tenant(7L, "Lian", "Batangas");
    }

    @Test
    void parentViewerCarriesTheChildAge() {
        when(studentRepository.findById(2L))
                .thenReturn(Optional.of(TestEntities.student(2L, LocalDate.of(2021, 6, 15), lian)));

        Viewer viewer = viewerResolver.resolve(PARENT, TODAY);

        assertThat(viewer.role()).isEqualTo(UserRoleType.PARENT);
        assertThat(viewer.tenantId()).isEqualTo(7L);
        assertThat(viewer.childAge().totalMonths()).isEqualTo(42);
    }

    @Test
    void childBornAfterTodayLeavesTheViewerWithoutAnAge() {
        when(studentRepository.findById(2L))
                .thenReturn(Optional.of(TestEntities.student(2L, LocalDate.of(2025, 3, 1), lian)));

        Viewer viewer = viewerResolver.resolve(PARENT, TODAY);

        assertThat(viewer.role()).isEqualTo(UserRoleType.PARENT);
        assertThat(viewer.tenantId()).isEqualTo(7L);
        assertThat(viewer.childAge()).isNull();
    }

    @Test
    void missingLinkedChildLeavesTheViewerWithoutAnAge() {
        when(studentRepository.findById(2L)).thenReturn(Optional.empty());

        assertThat(viewerResolver.resolve(PARENT, TODAY).childAge()).isNull();
    }
}
