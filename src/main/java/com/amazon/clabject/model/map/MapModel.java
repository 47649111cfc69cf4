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

package com.amazon.clabject.model.map;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import com.amazon.clabject.CycleDetectedException;
import com.amazon.clabject.Declaration;
import com.amazon.clabject.DeclarationId;
import com.amazon.clabject.DeclarationScope;
import com.amazon.clabject.FeatureKind;
import com.amazon.clabject.FeatureNotFoundException;
import com.amazon.clabject.Model;
import com.amazon.clabject.NodeId;
import com.amazon.clabject.PropagationFailedException;
import com.amazon.clabject.UnknownNodeException;

import com.amazon.clabject.spi.AncestorSynthesizer;
import com.amazon.clabject.spi.CarrierPool;
import com.amazon.clabject.spi.DeclarationStore;
import com.amazon.clabject.spi.Node;
import com.amazon.clabject.spi.NodeGraph;
import com.amazon.clabject.spi.PotencyResolver;
import com.amazon.clabject.spi.PropagationEngine;

/**
 * In-memory model, which wires the node graph, carrier pool, resolver,
 * synthesizer, propagation engine and declaration store together behind one
 * read-write lock. Mutations hold the write lock for their whole duration,
 * propagation included.
 *
 * @author Brian S O'Neill
 * @see MapModelBuilder
 */
class MapModel implements Model {
    private final Log mLog = LogFactory.getLog(MapModel.class);

    private final String mName;
    private final ReadWriteLock mLock;

    private final NodeGraph mGraph;
    private final CarrierPool mCarriers;
    private final AncestorSynthesizer mSynthesizer;
    private final PropagationEngine mEngine;
    private final DeclarationStore mStore;

    MapModel(MapModelBuilder builder) {
        if (builder.getName() == null) {
            throw new IllegalArgumentException("Model name cannot be null");
        }
        mName = builder.getName();
        mLock = builder.isLocking() ? new ReentrantReadWriteLock() : null;

        mGraph = new NodeGraph(builder.getRootName());
        mCarriers = new CarrierPool(mGraph);
        mSynthesizer = new AncestorSynthesizer(mGraph, new PotencyResolver(mGraph, mCarriers));
        mEngine = new PropagationEngine(mGraph, mSynthesizer);
        mStore = new DeclarationStore(mGraph, mCarriers, mEngine);

        if (mLog.isDebugEnabled()) {
            mLog.debug("Opened model \"" + mName + "\" with root " + mGraph.getRoot());
        }
    }

    public String getName() {
        return mName;
    }

    public NodeId getRoot() {
        return mGraph.getRoot();
    }

    public NodeId createNode(NodeId generator, String name, NodeId... explicitAncestors)
        throws UnknownNodeException, CycleDetectedException
    {
        List<NodeId> ancestors = ancestorList(explicitAncestors);
        lockForWrite();
        try {
            NodeId id = mGraph.createNode(generator, name, ancestors);
            boolean success = false;
            try {
                mSynthesizer.commit(id);
                success = true;
            } finally {
                if (!success) {
                    mLog.error("Withdrawing node " + id + " after ancestor synthesis failed");
                    mGraph.discard(id);
                }
            }
            return id;
        } finally {
            unlockFromWrite();
        }
    }

    public DeclarationId declare(NodeId owner, String name, FeatureKind kind, int potency,
                                 Object payload)
        throws UnknownNodeException, PropagationFailedException
    {
        lockForWrite();
        try {
            return mStore.declare(owner, name, kind, potency, payload).getId();
        } finally {
            unlockFromWrite();
        }
    }

    public Declaration resolve(NodeId node, String name)
        throws FeatureNotFoundException, UnknownNodeException
    {
        Declaration decl = tryResolve(node, name, null);
        if (decl == null) {
            throw new FeatureNotFoundException(node, name);
        }
        return decl;
    }

    public Declaration tryResolve(NodeId node, String name) throws UnknownNodeException {
        return tryResolve(node, name, null);
    }

    public Declaration tryResolve(NodeId node, String name, FeatureKind kind)
        throws UnknownNodeException
    {
        if (name == null) {
            throw new IllegalArgumentException("Feature name cannot be null");
        }
        lockForRead();
        try {
            for (NodeId id : linearize(node)) {
                Declaration decl = findVisible(mGraph.get(id), id.equals(node), name, kind);
                if (decl != null) {
                    return decl;
                }
            }
            return null;
        } finally {
            unlockFromRead();
        }
    }

    public List<NodeId> generatorChain(NodeId node)
        throws UnknownNodeException, CycleDetectedException
    {
        lockForRead();
        try {
            return Collections.unmodifiableList(mGraph.getGeneratorChain(node));
        } finally {
            unlockFromRead();
        }
    }

    public List<NodeId> lookupOrder(NodeId node) throws UnknownNodeException {
        lockForRead();
        try {
            return Collections.unmodifiableList(linearize(node));
        } finally {
            unlockFromRead();
        }
    }

    public List<NodeId> getResolvedAncestors(NodeId node) throws UnknownNodeException {
        lockForRead();
        try {
            return mGraph.getResolvedAncestors(node);
        } finally {
            unlockFromRead();
        }
    }

    public List<NodeId> getExplicitAncestors(NodeId node) throws UnknownNodeException {
        lockForRead();
        try {
            return mGraph.getExplicitAncestors(node);
        } finally {
            unlockFromRead();
        }
    }

    public void setExplicitAncestors(NodeId node, NodeId... explicitAncestors)
        throws UnknownNodeException, CycleDetectedException
    {
        List<NodeId> ancestors = ancestorList(explicitAncestors);
        lockForWrite();
        try {
            Node target = mGraph.getOrdinary(node, "a refined node");
            if (target.getGenerator() == null) {
                throw new IllegalArgumentException("Ancestors of the root cannot be refined");
            }
            for (NodeId ancestor : ancestors) {
                if (ancestor.equals(node)) {
                    throw new IllegalArgumentException("Node cannot be its own ancestor: " + node);
                }
                mGraph.getOrdinary(ancestor, "an explicit ancestor");
                if (linearize(ancestor).contains(node)) {
                    throw new CycleDetectedException
                        (node, "Ancestor " + ancestor + " already inherits from " + node);
                }
            }

            List<NodeId> original = target.getExplicitAncestors();
            mGraph.setExplicitAncestors(node, ancestors);
            boolean success = false;
            try {
                mSynthesizer.commit(node);
                success = true;
            } finally {
                if (!success) {
                    mGraph.setExplicitAncestors(node, original);
                }
            }
        } finally {
            unlockFromWrite();
        }
    }

    public void propagateFrom(NodeId node)
        throws UnknownNodeException, PropagationFailedException
    {
        lockForWrite();
        try {
            mEngine.propagateFrom(node);
        } finally {
            unlockFromWrite();
        }
    }

    public List<NodeId> getInstances(NodeId node) throws UnknownNodeException {
        lockForRead();
        try {
            return new ArrayList<NodeId>(mGraph.getInstances(node));
        } finally {
            unlockFromRead();
        }
    }

    public List<Declaration> getDeclarations(NodeId node) throws UnknownNodeException {
        lockForRead();
        try {
            return new ArrayList<Declaration>(mGraph.getDeclarations(node));
        } finally {
            unlockFromRead();
        }
    }

    public Declaration getDeclaration(DeclarationId id) {
        lockForRead();
        try {
            return mStore.get(id);
        } finally {
            unlockFromRead();
        }
    }

    public int getDepth(NodeId node) throws UnknownNodeException, CycleDetectedException {
        lockForRead();
        try {
            return mGraph.getGeneratorChain(node).size();
        } finally {
            unlockFromRead();
        }
    }

    public String getNodeName(NodeId node) throws UnknownNodeException {
        lockForRead();
        try {
            return mGraph.get(node).getName();
        } finally {
            unlockFromRead();
        }
    }

    public boolean isCarrier(NodeId node) throws UnknownNodeException {
        lockForRead();
        try {
            return mGraph.get(node).isCarrier();
        } finally {
            unlockFromRead();
        }
    }

    public NodeId getCarrier(NodeId owner, int potency) throws UnknownNodeException {
        DeclarationScope.forPotency(potency);
        lockForRead();
        try {
            mGraph.getOrdinary(owner, "a carrier owner");
            return mCarriers.peek(owner, potency);
        } finally {
            unlockFromRead();
        }
    }

    @Override
    public String toString() {
        return "MapModel {name=" + mName + '}';
    }

    /**
     * Returns the lookup order of a node: the node itself, then a depth first
     * walk of resolved ancestors, visiting each node once. Caller must hold a
     * lock.
     */
    private List<NodeId> linearize(NodeId node) throws UnknownNodeException {
        mGraph.get(node);
        List<NodeId> order = new ArrayList<NodeId>();
        Set<NodeId> visited = new HashSet<NodeId>();
        List<NodeId> stack = new ArrayList<NodeId>();
        stack.add(node);
        while (!stack.isEmpty()) {
            NodeId id = stack.remove(stack.size() - 1);
            if (!visited.add(id)) {
                continue;
            }
            order.add(id);
            List<NodeId> ancestors = mGraph.getResolvedAncestors(id);
            for (int i=ancestors.size(); --i>=0; ) {
                NodeId ancestor = ancestors.get(i);
                if (!visited.contains(ancestor)) {
                    stack.add(ancestor);
                }
            }
        }
        return order;
    }

    /**
     * Searches the declarations held by a node, most recent first. A node
     * sees only the object scoped declarations it holds itself. Through
     * inheritance, only instance scoped declarations of ordinary nodes are
     * visible, but every declaration held by a carrier is.
     */
    private static Declaration findVisible(Node holder, boolean self,
                                           String name, FeatureKind kind)
    {
        List<Declaration> decls = holder.getDeclarations();
        for (int i=decls.size(); --i>=0; ) {
            Declaration decl = decls.get(i);
            if (!name.equals(decl.getName())) {
                continue;
            }
            if (kind != null && kind != decl.getKind()) {
                continue;
            }
            DeclarationScope scope = decl.getScope();
            if (self ? scope == DeclarationScope.OBJECT
                : (holder.isCarrier() || scope == DeclarationScope.INSTANCE))
            {
                return decl;
            }
        }
        return null;
    }

    private static List<NodeId> ancestorList(NodeId[] explicitAncestors) {
        if (explicitAncestors == null || explicitAncestors.length == 0) {
            return Collections.emptyList();
        }
        List<NodeId> list = Arrays.asList(explicitAncestors);
        if (list.contains(null)) {
            throw new IllegalArgumentException("Explicit ancestor cannot be null");
        }
        return list;
    }

    private void lockForRead() {
        if (mLock != null) {
            mLock.readLock().lock();
        }
    }

    private void unlockFromRead() {
        if (mLock != null) {
            mLock.readLock().unlock();
        }
    }

    private void lockForWrite() {
        if (mLock != null) {
            mLock.writeLock().lock();
        }
    }

    private void unlockFromWrite() {
        if (mLock != null) {
            mLock.writeLock().unlock();
        }
    }
}
