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

package io.github.sachinnimbal.transferx.core.annotations;

import java.lang.annotation.*;

/**
 * Per-field DTO metadata.
 *
 * <pre>
 * public record Person(
 *     &#64;DtoField(mark = "read-only") UUID id,
 *     String name,
 *     &#64;DtoField(mark = "private") String passwordHash) {}
 * </pre>
 */
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface DtoField {

    /**
     * One of {@code read-only}, {@code write-only}, {@code private}, or empty.
     */
    String mark() default "";

    /**
     * Restricts the field to one direction: {@code data} or {@code return}.
     * Empty means both.
     */
    String dtoFor() default "";

    /**
     * Skip the field entirely, as if it were not declared.
     */
    boolean ignore() default false;
}
