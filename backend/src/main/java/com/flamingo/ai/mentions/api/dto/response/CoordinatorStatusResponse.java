package com.flamingo.ai.mentions.api.dto.response;

import com.flamingo.ai.mentions.service.coordinator.PerformanceStats;
import com.flamingo.ai.mentions.service.coordinator.QueueStatus;

/** Extraction pool status and lifetime performance. */
public record CoordinatorStatusResponse(QueueStatus queue, PerformanceStats performance) {}
