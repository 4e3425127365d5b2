package com.acme.brickwatch.web;

import com.acme.brickwatch.scheduler.DeadlineScheduler;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;

@Controller
public class HealthController {

  private final DeadlineScheduler scheduler;

  public HealthController(DeadlineScheduler scheduler) {
    this.scheduler = scheduler;
  }

  @Get("/health")
  public HttpResponse<String> health() {
    String schedulerState = scheduler.isRunning() ? "RUNNING" : "STOPPED";
    return HttpResponse.ok("{\"status\":\"UP\",\"scheduler\":\"" + schedulerState + "\"}");
  }
}
