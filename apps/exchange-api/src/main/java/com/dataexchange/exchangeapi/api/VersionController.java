package com.dataexchange.exchangeapi.api;

import com.dataexchange.exchangeapi.config.ServiceInfo;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
public class VersionController {
  private final ServiceInfo serviceInfo;

  public VersionController(ServiceInfo serviceInfo) {
    this.serviceInfo = serviceInfo;
  }

  @GetMapping("/version")
  public VersionResponse version() {
    return new VersionResponse(
        serviceInfo.applicationName(), serviceInfo.version(), serviceInfo.buildTime());
  }
}
