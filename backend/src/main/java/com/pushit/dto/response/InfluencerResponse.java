package com.pushit.dto.response;

import com.pushit.entity.Influencer;
import com.pushit.entity.InfluencerVerificationStatus;
import com.pushit.entity.Platform;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InfluencerResponse {
    private Long id;
    private String displayName;
    private String bio;
    private String niche;
    private Platform primaryPlatform;
    private InfluencerVerificationStatus verificationStatus;
    private boolean profileCompleted;
    private String currency;
    private boolean paused;
    private String pauseReason;
    private List<PlatformConnectionResponse> platforms;

    public static InfluencerResponse fromEntity(
            Influencer influencer, List<PlatformConnectionResponse> platforms) {
        return InfluencerResponse.builder()
                .id(influencer.getId())
                .displayName(influencer.getDisplayName())
                .bio(influencer.getBio())
                .niche(influencer.getNiche())
                .primaryPlatform(influencer.getPrimaryPlatform())
                .verificationStatus(influencer.getVerificationStatus())
                .profileCompleted(influencer.isProfileCompleted())
                .currency(
                        influencer.getCurrency() != null
                                ? influencer.getCurrency().getCode()
                                : null)
                .paused(influencer.isPaused())
                .pauseReason(influencer.getPauseReason())
                .platforms(platforms)
                .build();
    }
}
