/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.seeker.domain.protocol;

import java.util.Objects;

/**
 * Either a decoded message or a {@link DecodeError}, never both.
 *
 * @param <T>
 *            decoded message type
 */
public final class DecodeResult<T> {

    private final T value;
    private final DecodeError error;

    private DecodeResult(T value, DecodeError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> DecodeResult<T> success(T value) {
        return new DecodeResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> DecodeResult<T> failure(DecodeError error) {
        return new DecodeResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("Decode failed: " + error.describe());
        }
        return value;
    }

    public DecodeError getError() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DecodeResult<?> other)) {
            return false;
        }
        return Objects.equals(value, other.value) && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "DecodeResult[" + value + "]" : "DecodeResult[" + error.describe() + "]";
    }
}
