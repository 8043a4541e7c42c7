/*
 * Copyright 2015 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.placement;

/**
 * A resource quantity string that could not be parsed, or that parsed to a negative or out of range value.
 */
public class ResourceQuantityException extends PlacementException {

    private final String quantity;

    public ResourceQuantityException(String quantity, String message) {
        super("Invalid resource quantity '" + quantity + "': " + message);
        this.quantity = quantity;
    }

    public ResourceQuantityException(String quantity, String message, Throwable throwable) {
        super("Invalid resource quantity '" + quantity + "': " + message, throwable);
        this.quantity = quantity;
    }

    /**
     * @return the offending quantity string, possibly {@code null}
     */
    public String getQuantity() {
        return quantity;
    }
}
