package com.example.itop_notification.model;

public record Team(String id, String friendlyName) {}
