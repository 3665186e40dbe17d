package com.splitttr.realtime.session;

import com.splitttr.realtime.operation.DocumentState;

import java.util.Optional;

@FunctionalInterface
public interface ResourceStateProvider {

    Optional<DocumentState> getResourceState(String resourceId, ResourceType resourceType);
}
