package com.flamingo.inboundmail.api.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a partial organization update. Absent fields are left unchanged. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateOrganizationRequest {

  @Size(min = 1, max = 255, message = "Name must be between 1 and 255 characters")
  @Pattern(regexp = ".*\\S.*", message = "Name must not be blank")
  private String name;

  @Email(message = "Webhook email must be a valid address")
  private String webhookEmail;

  @Pattern(regexp = ".*\\S.*", message = "Mandrill webhook secret must not be blank")
  private String mandrillWebhookSecret;

  private Boolean active;
}
