package com.hhplus.coffeeshop.presentation.notification.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class UnreadCountResponse {

    @JsonProperty("unread_count")
    private Long unreadCount;
}
