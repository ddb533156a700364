/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class BocadoGatewayApplication {
    public static void main(String[] args) {
        SpringApplication.run(BocadoGatewayApplication.class, args);
    }
}
