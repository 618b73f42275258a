package com.ai.callanalytics.dto;

import com.ai.callanalytics.entity.FollowUpScript;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDateTime;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScriptDto {

    private Long id;
    private Long conversationId;
    private String scriptContent;
    private boolean sent;
    private LocalDateTime sentAt;
    private LocalDateTime createdAt;

    public static ScriptDto from(FollowUpScript s) {
        return ScriptDto.builder()
                .id(s.getId())
                .conversationId(s.getConversation().getId())
                .scriptContent(s.getScriptContent())
                .sent(s.isSent())
                .sentAt(s.getSentAt())
                .createdAt(s.getCreatedAt())
                .build();
    }
}
