package com.phillippitts.phiredaction.presentation.dto;

import com.phillippitts.phiredaction.service.slowlane.SlowPassStatus;

public record SlowPassResponse(String sessionId, SlowPassStatus status) {}
