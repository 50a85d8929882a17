package com.pushit.service.verification;

import com.pushit.entity.Platform;
import com.pushit.entity.PlatformConnection;

/**
 * Rule battery for one platform. Implementations do not persist anything; the caller applies the
 * result to the connection.
 */
public interface PlatformVerifier {

    Platform platform();

    VerificationResult verify(PlatformConnection connection, long minimumFollowers);
}
