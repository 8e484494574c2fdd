/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ArchelystApplication {
    public static void main(String[] args) {
        SpringApplication.run(ArchelystApplication.class, args);
    }
}
