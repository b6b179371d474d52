package com.cdcportal.backend.modules.content.domain;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Set;

import com.cdcportal.backend.global.jpa.AbstractTimestampedEntity;
import com.cdcportal.backend.modules.account.domain.UserAccount;
import com.cdcportal.backend.modules.account.domain.UserRoleType;
import com.cdcportal.backend.modules.age.domain.AgeBand;
import com.cdcportal.backend.modules.tenant.domain.Tenant;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * Activity a worker assigns for home. Targeted by catalog age band; no band means all ages.
 */
@Entity
@Table(name = "take_home_activities")
public class TakeHomeActivity extends AbstractTimestampedEntity {

    public static final Set<UserRoleType> AUDIENCE =
            EnumSet.of(UserRoleType.PARENT, UserRoleType.WORKER, UserRoleType.PRESIDENT);

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @Column(name = "due_date")
    private LocalDate dueDate;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "assigned_by")
    private UserAccount assignedBy;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "cdc_id", nullable = false, updatable = false)
    private Tenant tenant;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "age_group_id")
    private AgeBand ageBand;

    @Column(name = "file_path", length = 500)
    private String filePath;

    @Column(name = "file_name", length = 255)
    private String fileName;

    protected TakeHomeActivity() {
    }

    public TakeHomeActivity(Tenant tenant, UserAccount assignedBy) {
        this.tenant = tenant;
        this.assignedBy = assignedBy;
    }

    public Long getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public LocalDate getDueDate() {
        return dueDate;
    }

    public void setDueDate(LocalDate dueDate) {
        this.dueDate = dueDate;
    }

    public UserAccount getAssignedBy() {
        return assignedBy;
    }

    public Tenant getTenant() {
        return tenant;
    }

    public Long getTenantId() {
        return tenant.getId();
    }

    public AgeBand getAgeBand() {
        return ageBand;
    }

    public void setAgeBand(AgeBand ageBand) {
        this.ageBand = ageBand;
    }

    public Long getAgeBandId() {
        return ageBand == null ? null : ageBand.getId();
    }

    public String getFilePath() {
        return filePath;
    }

    public String getFileName() {
        return fileName;
    }

    public void setFile(String filePath, String fileName) {
        this.filePath = filePath;
        this.fileName = fileName;
    }

    public TargetedContent toTargetedContent() {
        String ageFilter = ageBand == null ? ContentTargeting.ALL_AGES : ageBand.bandKey();
        return new TargetedContent(id, getTenantId(), ageFilter, AUDIENCE, null);
    }
}
