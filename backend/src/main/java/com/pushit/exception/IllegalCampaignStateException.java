package com.pushit.exception;

import com.pushit.entity.CampaignStatus;
import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/** Raised when a campaign operation is not allowed in the campaign's current status. */
@Getter
@ResponseStatus(HttpStatus.CONFLICT)
public class IllegalCampaignStateException extends RuntimeException {

    private final Long campaignId;
    private final CampaignStatus currentStatus;

    public IllegalCampaignStateException(
            Long campaignId, CampaignStatus currentStatus, String message) {
        super(String.format("Campaign %d is %s: %s", campaignId, currentStatus, message));
        this.campaignId = campaignId;
        this.currentStatus = currentStatus;
    }
}
