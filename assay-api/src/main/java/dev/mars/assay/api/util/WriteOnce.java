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
package dev.mars.assay.api.util;

import dev.mars.assay.api.error.AssayErrorCodes;
import dev.mars.assay.api.error.UninitializedPropertyException;

import java.util.Objects;

/**
 * A named value slot that is either unset or holds a value.
 *
 * <p>A slot accepts a single write. Reading an unset slot throws {@link UninitializedPropertyException} naming the
 * property and the owning type. A set value may itself be {@code null} (for optional
 * properties such as a skip reason), which is distinct from being unset.</p>
 *
 * <p>Not thread-safe: a slot is expected to be written by a single thread before the
 * owning object is published.</p>
 *
 * @param <T> the value type
 */
public final class WriteOnce<T> {

    private final String propertyName;
    private final Class<?> ownerType;
    private boolean set;
    private T value;

    public WriteOnce(String propertyName, Class<?> ownerType) {
        this.propertyName = Objects.requireNonNull(propertyName, "Property name cannot be null");
        this.ownerType = Objects.requireNonNull(ownerType, "Owner type cannot be null");
    }

    /**
     * Gets the value, failing if it has not been set.
     *
     * @return the stored value, possibly {@code null}
     * @throws UninitializedPropertyException if the slot is unset
     */
    public T get() {
        if (!set) {
            throw new UninitializedPropertyException(propertyName, ownerType);
        }
        return value;
    }

    /**
     * Stores the value.
     *
     * @throws IllegalStateException if the slot has already been written
     */
    public void set(T value) {
        if (set) {
            throw new IllegalStateException(String.format("[%s] %s on '%s' has already been set",
                AssayErrorCodes.ALREADY_INITIALIZED, propertyName, ownerType.getName()));
        }
        this.value = value;
        this.set = true;
    }

    public boolean isSet() {
        return set;
    }

    public String getPropertyName() {
        return propertyName;
    }

    @Override
    public String toString() {
        return set ? String.valueOf(value) : "<unset>";
    }
}
