package com.brandinsight.research.service.discovery;

public record ExtractedHandle(String platform, String handle) {
}
