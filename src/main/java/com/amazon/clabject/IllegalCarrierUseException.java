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
 * Thrown when a carrier is passed where only an ordinary node is accepted:
 * as a generator, as an explicit ancestor, or as the owner of a declaration.
 * Carriers are only reachable through resolved ancestor lists.
 *
 * @author Brian S O'Neill
 */
public class IllegalCarrierUseException extends MalformedArgumentException {

    private static final long serialVersionUID = 1L;

    private final NodeId mCarrier;

    public IllegalCarrierUseException(NodeId carrier, String usage) {
        super("Carrier " + carrier + " cannot be used as " + usage);
        mCarrier = carrier;
    }

    public NodeId getCarrier() {
        return mCarrier;
    }
}
