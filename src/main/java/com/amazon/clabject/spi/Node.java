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

package com.amazon.clabject.spi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.amazon.clabject.Declaration;
import com.amazon.clabject.NodeId;

/**
 * Mutable record of one node in a {@link NodeGraph}. Ordinary nodes and
 * carriers share this shape; a carrier has no generator and records the owner
 * and potency it carries declarations for.
 *
 * <p>Only the graph mutates nodes. Accessors return unmodifiable views.
 *
 * @author Brian S O'Neill
 */
public final class Node {
    private final NodeId mId;
    private final String mName;
    private final NodeId mGenerator;

    private final NodeId mCarrierOwner;
    private final int mCarrierPotency;

    private List<NodeId> mExplicitAncestors;
    private List<NodeId> mResolvedAncestors;

    private final List<Declaration> mDeclarations;
    private final List<NodeId> mInstances;

    Node(NodeId id, String name, NodeId generator, List<NodeId> explicitAncestors) {
        this(id, name, generator, null, 0);
        mExplicitAncestors = Collections.unmodifiableList
            (new ArrayList<NodeId>(explicitAncestors));
    }

    Node(NodeId id, String name, NodeId generator, NodeId carrierOwner, int carrierPotency) {
        mId = id;
        mName = name;
        mGenerator = generator;
        mCarrierOwner = carrierOwner;
        mCarrierPotency = carrierPotency;
        mExplicitAncestors = Collections.emptyList();
        mResolvedAncestors = Collections.emptyList();
        mDeclarations = new ArrayList<Declaration>();
        mInstances = new ArrayList<NodeId>();
    }

    public NodeId getId() {
        return mId;
    }

    /**
     * Returns the display name, or null if none.
     */
    public String getName() {
        return mName;
    }

    /**
     * Returns the node this one was instantiated from, or null for the root
     * and for carriers.
     */
    public NodeId getGenerator() {
        return mGenerator;
    }

    public boolean isCarrier() {
        return mCarrierOwner != null;
    }

    /**
     * Returns the node whose deep declarations this carrier holds, or null if
     * not a carrier.
     */
    public NodeId getCarrierOwner() {
        return mCarrierOwner;
    }

    /**
     * Returns the potency of the declarations this carrier holds, or zero if
     * not a carrier.
     */
    public int getCarrierPotency() {
        return mCarrierPotency;
    }

    public List<NodeId> getExplicitAncestors() {
        return mExplicitAncestors;
    }

    public List<NodeId> getResolvedAncestors() {
        return mResolvedAncestors;
    }

    public List<Declaration> getDeclarations() {
        return Collections.unmodifiableList(mDeclarations);
    }

    public List<NodeId> getInstances() {
        return Collections.unmodifiableList(mInstances);
    }

    void setExplicitAncestors(List<NodeId> ancestors) {
        mExplicitAncestors = Collections.unmodifiableList(new ArrayList<NodeId>(ancestors));
    }

    void setResolvedAncestors(List<NodeId> ancestors) {
        mResolvedAncestors = Collections.unmodifiableList(new ArrayList<NodeId>(ancestors));
    }

    void addDeclaration(Declaration decl) {
        mDeclarations.add(decl);
    }

    boolean removeDeclaration(Declaration decl) {
        return mDeclarations.remove(decl);
    }

    void addInstance(NodeId instance) {
        mInstances.add(instance);
    }

    boolean removeInstance(NodeId instance) {
        return mInstances.remove(instance);
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder();
        if (isCarrier()) {
            b.append("Carrier ").append(mId).append(" {owner=").append(mCarrierOwner);
            b.append(", potency=").append(mCarrierPotency).append('}');
        } else {
            b.append("Node ").append(mId);
            if (mName != null) {
                b.append(" \"").append(mName).append('"');
            }
            if (mGenerator != null) {
                b.append(" {generator=").append(mGenerator).append('}');
            }
        }
        return b.toString();
    }
}
