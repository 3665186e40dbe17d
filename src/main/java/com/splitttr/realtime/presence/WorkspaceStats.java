package com.splitttr.realtime.presence;

public record WorkspaceStats(int totalUsers, int onlineUsers, int activeUsers, int awayUsers) {}
