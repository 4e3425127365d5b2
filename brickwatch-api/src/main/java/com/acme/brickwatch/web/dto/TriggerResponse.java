package com.acme.brickwatch.web.dto;

import com.acme.brickwatch.service.TriggerResult;

/**
 * @param recovered the brick was late and is now timely again
 * @param unpaused the trigger resumed a paused brick
 */
public record TriggerResponse(String status, boolean recovered, boolean unpaused) {

  public static TriggerResponse from(TriggerResult result) {
    return new TriggerResponse("ok", result.recovered(), result.unpaused());
  }
}
