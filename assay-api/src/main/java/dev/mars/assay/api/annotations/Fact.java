/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
package dev.mars.assay.api.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as a test. Annotation types meta-annotated with {@code @Fact}
 * (such as {@link Theory}) are treated as fact-like.
 *
 * <p>Empty strings mean "not set": an empty {@link #displayName()} falls back to the
 * default display name and an empty {@link #skip()} means the test is not skipped.</p>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.ANNOTATION_TYPE})
public @interface Fact {

    /**
     * @return display name override
     */
    String displayName() default "";

    /**
     * @return reason the test is skipped; empty when it runs
     */
    String skip() default "";

    /**
     * @return timeout in milliseconds, 0 for no timeout
     */
    int timeout() default 0;
}
