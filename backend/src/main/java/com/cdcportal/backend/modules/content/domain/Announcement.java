package com.cdcportal.backend.modules.content.domain;

import java.util.Set;

import com.cdcportal.backend.global.jpa.AbstractTimestampedEntity;
import com.cdcportal.backend.modules.account.domain.UserAccount;
import com.cdcportal.backend.modules.account.domain.UserRoleType;
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
 * Announcement targeted by age band, role and tenant. Without a tenant it is a
 * broadcast; broadcasts are seeded by operators, not through the API.
 */
@Entity
@Table(name = "announcements")
public class Announcement extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "message", nullable = false, columnDefinition = "text")
    private String message;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "author_id")
    private UserAccount author;

    @Column(name = "author_name", length = 150)
    private String authorName;

    @Column(name = "age_filter", nullable = false, length = 16)
    private String ageFilter;

    @Column(name = "role_filter", nullable = false, length = 128)
    private String roleFilter;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "cdc_id")
    private Tenant tenant;

    // opaque reference into file storage
    @Column(name = "attachment_path", length = 500)
    private String attachmentPath;

    @Column(name = "attachment_name", length = 255)
    private String attachmentName;

    protected Announcement() {
    }

    public Announcement(String title, String message, UserAccount author, String ageFilter,
                        Set<UserRoleType> audience, Tenant tenant) {
        this.title = title;
        this.message = message;
        this.author = author;
        this.authorName = author == null ? null : author.getFullName();
        this.ageFilter = ageFilter;
        this.roleFilter = Audience.format(audience);
        this.tenant = tenant;
    }

    public Long getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getMessage() {
        return message;
    }

    public UserAccount getAuthor() {
        return author;
    }

    public String getAuthorName() {
        return authorName;
    }

    public String getAgeFilter() {
        return ageFilter;
    }

    public Set<UserRoleType> getAudience() {
        return Audience.parse(roleFilter);
    }

    public Tenant getTenant() {
        return tenant;
    }

    public Long getTenantId() {
        return tenant == null ? null : tenant.getId();
    }

    public String getAttachmentPath() {
        return attachmentPath;
    }

    public String getAttachmentName() {
        return attachmentName;
    }

    public void setAttachment(String attachmentPath, String attachmentName) {
        this.attachmentPath = attachmentPath;
        this.attachmentName = attachmentName;
    }

    public TargetedContent toTargetedContent() {
        return new TargetedContent(id, getTenantId(), ageFilter, getAudience(),
                tenant == null || tenant.getLocation() == null ? null : tenant.getLocation().toGeography());
    }
}
