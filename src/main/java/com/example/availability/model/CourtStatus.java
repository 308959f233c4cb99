package com.example.availability.model;

public enum CourtStatus { ACTIVE, MAINTENANCE, INACTIVE }
