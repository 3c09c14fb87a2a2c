package com.spendings.backend.dto;

import java.util.List;

public record DueRemindersDTO(List<ReminderDTO> due) {}
