package com.splitttr.realtime.rest.dto;

import com.splitttr.realtime.session.ResourceType;

public record OpenSessionRequest(String resourceId, ResourceType resourceType, String workspaceId) {}
