package com.flamingo.inboundmail.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of a 202 webhook acknowledgement. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookAckResponse {
  private String status;
}
