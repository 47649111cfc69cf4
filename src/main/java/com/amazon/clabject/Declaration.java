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
 * A named feature declared upon a node, tagged with a potency. Declarations
 * are immutable, and are shared by reference with every resolution which finds
 * them.
 *
 * <p>The <i>owner</i> is the node the feature was declared on. The
 * <i>holder</i> is the node which physically carries the declaration: the
 * owner itself for object and instance scoped declarations, or the carrier for
 * the owner and potency pair when the declaration is deep.
 *
 * @author Brian S O'Neill
 * @see Model#declare
 */
public class Declaration {
    private final DeclarationId mId;
    private final NodeId mOwner;
    private final NodeId mHolder;
    private final String mName;
    private final FeatureKind mKind;
    private final int mPotency;
    private final Object mPayload;

    /**
     * @throws IllegalArgumentException if any required argument is null
     * @throws InvalidPotencyException if potency is negative
     */
    public Declaration(DeclarationId id, NodeId owner, NodeId holder,
                       String name, FeatureKind kind, int potency, Object payload)
    {
        if (id == null || owner == null || holder == null) {
            throw new IllegalArgumentException("Declaration identity is incomplete");
        }
        if (name == null) {
            throw new IllegalArgumentException("Feature name cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Feature kind cannot be null");
        }
        if (potency < 0) {
            throw new InvalidPotencyException(potency);
        }
        mId = id;
        mOwner = owner;
        mHolder = holder;
        mName = name;
        mKind = kind;
        mPotency = potency;
        mPayload = payload;
    }

    public DeclarationId getId() {
        return mId;
    }

    /**
     * Returns the node this feature was declared on.
     */
    public NodeId getOwner() {
        return mOwner;
    }

    /**
     * Returns the node holding this declaration, which is a carrier for deep
     * declarations.
     */
    public NodeId getHolder() {
        return mHolder;
    }

    public String getName() {
        return mName;
    }

    public FeatureKind getKind() {
        return mKind;
    }

    public int getPotency() {
        return mPotency;
    }

    public DeclarationScope getScope() {
        return DeclarationScope.forPotency(mPotency);
    }

    /**
     * Returns the feature's behavior or shape, which is opaque to the model.
     */
    public Object getPayload() {
        return mPayload;
    }

    @Override
    public int hashCode() {
        return mId.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof Declaration) {
            return mId.equals(((Declaration) obj).mId);
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder();
        b.append(mKind.name().toLowerCase()).append(' ');
        b.append(mName).append('@').append(mPotency);
        b.append(" on ").append(mOwner);
        if (!mHolder.equals(mOwner)) {
            b.append(" via ").append(mHolder);
        }
        return b.toString();
    }
}
