package com.swisspairing.dto;

public record ClearResponse(long deleted) {
}
