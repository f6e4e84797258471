package com.playfactory.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/servers.
 *
 * @param description optional, up to 500 characters
 * @param userCode    JavaScript game module exporting initGame and handlePlayerAction
 */
public record CreateServerRequest(
    String name,
    String description,
    @JsonProperty("user_code") String userCode
) {}
