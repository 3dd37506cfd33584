package com.chainindexer.domain;

import com.chainindexer.common.ContentIdGenerator;

import java.util.Map;

/**
 * Anything identified by a hash of its identifying fields. Timestamps, derived values and the id itself
 * are never part of {@link #identifyingFields()}.
 */
public interface ContentAddressable {

    Map<String, Object> identifyingFields();

    default String contentId() {
        return ContentIdGenerator.generate(identifyingFields());
    }
}
