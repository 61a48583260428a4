package com.brandinsight.research.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Latest scraped state of a social profile (the target's own or a competitor's).
 */
@Entity
@Table(name = "social_profile_snapshots",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_social_profiles_job_platform_handle",
                columnNames = {"research_job_id", "platform", "handle"}),
        indexes = @Index(name = "idx_social_profiles_job_id", columnList = "research_job_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SocialProfileSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "research_job_id", nullable = false, length = 64)
    private String researchJobId;

    @Column(name = "platform", nullable = false, length = 32)
    private String platform;

    @Column(name = "handle", nullable = false, length = 128)
    private String handle;

    @Column(name = "followers")
    private Long followers;

    @Column(name = "following")
    private Long following;

    @Column(name = "posts_count")
    private Integer postsCount;

    @Column(name = "bio", columnDefinition = "TEXT")
    private String bio;

    @Column(name = "profile_url", length = 1024)
    private String profileUrl;

    @Column(name = "is_target", nullable = false)
    @Builder.Default
    private boolean target = false;

    @UpdateTimestamp
    @Column(name = "scraped_at")
    private LocalDateTime scrapedAt;

    /**
     * Copy scraped values onto this row, keeping its identity
     */
    public void refreshFrom(SocialProfileSnapshot scraped) {
        this.followers = scraped.getFollowers();
        this.following = scraped.getFollowing();
        this.postsCount = scraped.getPostsCount();
        this.bio = scraped.getBio();
        this.profileUrl = scraped.getProfileUrl();
        this.target = scraped.isTarget();
    }
}
