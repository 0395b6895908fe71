package com.serenity.escalation.config;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DeliveryReceiptNatsPropertiesValidationTest {

  private static final String SUBJECT = "crisis.delivery.receipts";
  private static final String STREAM = "CRISIS_DELIVERY_RECEIPTS";
  private static final String DURABLE = "escalation-delivery-receipts";
  private static final Duration DUPLICATE_WINDOW = Duration.ofMinutes(2);
  private static final Duration ACK_WAIT = Duration.ofSeconds(30);

  private Validator validator;

  @BeforeEach
  void setUp() {
    validator = Validation.buildDefaultValidatorFactory().getValidator();
  }

  @Test
  void validSettingsPass() {
    assertThat(validator.validate(properties(ACK_WAIT, 5))).isEmpty();
  }

  @Test
  void zeroAckWaitFails() {
    assertThat(validator.validate(properties(Duration.ZERO, 5))).isNotEmpty();
  }

  @Test
  void zeroMaxDeliverFails() {
    assertThat(validator.validate(properties(ACK_WAIT, 0))).isNotEmpty();
  }

  private DeliveryReceiptNatsProperties properties(Duration ackWait, int maxDeliver) {
    return new DeliveryReceiptNatsProperties(
        true, SUBJECT, STREAM, DURABLE, DUPLICATE_WINDOW, ackWait, maxDeliver);
  }
}
