package com.incarts.analytics.infrastructure.emulated;

import lombok.Value;

/**
 * What a {@link TableBackend} can do server-side beyond filtering.
 */
@Value
public class BackendCapabilities {

    boolean ordering;
    boolean pagination;
}
