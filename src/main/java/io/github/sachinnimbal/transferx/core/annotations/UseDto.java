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
 * Binds DTO classes to a controller method.
 * {@code data} decodes the {@link DtoBody} parameter, {@code returns} encodes the return value.
 * Leave either as {@code void.class} to skip that direction.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface UseDto {

    Class<?> data() default void.class;

    Class<?> returns() default void.class;
}
