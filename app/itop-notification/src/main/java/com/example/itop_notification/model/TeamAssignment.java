package com.example.itop_notification.model;

public record TeamAssignment(
    String ticketId, String ticketClass, String teamId, String timestamp) {}
