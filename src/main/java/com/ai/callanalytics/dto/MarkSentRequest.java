package com.ai.callanalytics.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class MarkSentRequest {

    /** Defaults to the server clock when omitted. */
    private LocalDateTime sentAt;
}
