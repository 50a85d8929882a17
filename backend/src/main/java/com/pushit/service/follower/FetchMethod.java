package com.pushit.service.follower;

/** Where a follower count came from. MANUAL means no automatic source produced one. */
public enum FetchMethod {
    API,
    PROXY,
    SCRAPE,
    MANUAL
}
