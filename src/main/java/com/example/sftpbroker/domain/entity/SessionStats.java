package com.example.sftpbroker.domain.entity;

/**
 * Registry occupancy at one instant.
 *
 * @param activeSessions registered sessions that are not yet idle past the timeout
 * @param totalSessions  all registered sessions, including expired ones not yet swept
 */
public record SessionStats(int activeSessions, int totalSessions, int maxSessions) {}
