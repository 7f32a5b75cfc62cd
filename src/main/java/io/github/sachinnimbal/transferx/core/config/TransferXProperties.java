/*
 * Copyright 2025 Sachin Nimbal
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.sachinnimbal.transferx.core.config;

import io.github.sachinnimbal.transferx.core.enums.TransferBackendMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "transferx")
public class TransferXProperties {

    // ==================== DTO PROPERTIES ====================

    private Dto dto = new Dto();

    @Data
    public static class Dto {
        /**
         * Enable/disable DTO handling of {@code @UseDto} handlers
         * Default: true
         */
        private boolean enabled = true;

        /**
         * Transfer engine used by DTOs that do not choose one themselves
         * Default: CODEGEN
         */
        private TransferBackendMode backend = TransferBackendMode.CODEGEN;

        /**
         * Bind every {@code @UseDto} handler at startup, failing fast on
         * mismatched handler types. When false, handlers bind on first request.
         * Default: true
         */
        private boolean eagerRegistration = true;

        /**
         * Log each binding at INFO level
         * Default: true
         */
        private boolean logBindings = true;
    }

    // ==================== SWAGGER PROPERTIES ====================

    private Swagger swagger = new Swagger();

    @Data
    public static class Swagger {
        /**
         * Publish transfer model schemas in the OpenAPI document (requires springdoc)
         * Default: true
         */
        private boolean enabled = true;
    }
}
