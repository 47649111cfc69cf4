/*
 * Copyright 2006 Amazon Technologies, Inc. or its affiliates.
 * Amazon, Amazon.com and Carbonado are trademarks or registered trademarks
 * of Amazon Technologies, Inc. or its affiliates.  All rights reserved.
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

package com.amazon.clabject;

/**
 * Visibility class of a {@link Declaration}, derived from its potency.
 *
 * @author Brian S O'Neill
 */
public enum DeclarationScope {
    /**
     * Potency zero. Visible only on the declaring node itself, and never
     * inherited.
     */
    OBJECT,

    /**
     * Potency one. Visible on the declaring node's direct instances, and by
     * ordinary inheritance on every node below them.
     */
    INSTANCE,

    /**
     * Potency two or more. Latent until the declared number of instantiation
     * levels has elapsed, and held by a carrier instead of the declaring node.
     */
    DEEP;

    /**
     * Returns the scope for the given potency.
     *
     * @throws InvalidPotencyException if potency is negative
     */
    public static DeclarationScope forPotency(int potency) {
        if (potency < 0) {
            throw new InvalidPotencyException(potency);
        }
        switch (potency) {
        case 0:
            return OBJECT;
        case 1:
            return INSTANCE;
        default:
            return DEEP;
        }
    }
}
