package com.ai.callanalytics.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * A conversation together with its ordered messages and, when it exists, its analysis.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ConversationDetailDto {

    private ConversationDto conversation;

    private List<MessageDto> messages;

    private AnalysisDto analysis;
}
