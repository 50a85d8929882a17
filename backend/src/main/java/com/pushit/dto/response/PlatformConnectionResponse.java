package com.pushit.dto.response;

import com.pushit.entity.ConnectionVerificationStatus;
import com.pushit.entity.Platform;
import com.pushit.entity.PlatformConnection;
import com.pushit.entity.VerificationMethod;
import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlatformConnectionResponse {
    private Long id;
    private Long influencerId;
    private Platform platform;
    private String handle;
    private long followersCount;
    private Long verifiedFollowersCount;
    private double engagementRate;
    private long averageViews;
    private String samplePostUrl;
    private ConnectionVerificationStatus verificationStatus;
    private double verificationConfidence;
    private List<String> verificationFlags;
    private VerificationMethod verificationMethod;
    private LocalDateTime verifiedAt;

    public static PlatformConnectionResponse fromEntity(PlatformConnection connection) {
        return PlatformConnectionResponse.builder()
                .id(connection.getId())
                .influencerId(
                        connection.getInfluencer() != null
                                ? connection.getInfluencer().getId()
                                : null)
                .platform(connection.getPlatform())
                .handle(connection.getHandle())
                .followersCount(connection.getFollowersCount())
                .verifiedFollowersCount(connection.getVerifiedFollowersCount())
                .engagementRate(connection.getEngagementRate())
                .averageViews(connection.getAverageViews())
                .samplePostUrl(connection.getSamplePostUrl())
                .verificationStatus(connection.getVerificationStatus())
                .verificationConfidence(connection.getVerificationConfidence())
                .verificationFlags(List.copyOf(connection.getVerificationFlags()))
                .verificationMethod(connection.getVerificationMethod())
                .verifiedAt(connection.getVerifiedAt())
                .build();
    }
}
