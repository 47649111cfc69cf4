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
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.amazon.clabject.CycleDetectedException;
import com.amazon.clabject.Declaration;
import com.amazon.clabject.IllegalCarrierUseException;
import com.amazon.clabject.NodeId;
import com.amazon.clabject.UnknownNodeException;

/**
 * Owns every node and carrier of a model, along with the generator edges, the
 * reverse generator index, and the resolved ancestor edges. The graph holds
 * data and answers structural queries only. Deciding what the resolved
 * ancestors should be is the job of {@link AncestorSynthesizer}.
 *
 * <p>NodeGraph is not thread-safe. Callers must serialize access.
 *
 * @author Brian S O'Neill
 */
public class NodeGraph {
    private final Map<NodeId, Node> mNodes;
    private final NodeId mRoot;
    private long mNextId;

    /**
     * @param rootName display name of the root node, which may be null
     */
    public NodeGraph(String rootName) {
        mNodes = new HashMap<NodeId, Node>();
        mRoot = nextId();
        mNodes.put(mRoot, new Node(mRoot, rootName, null, Collections.<NodeId>emptyList()));
    }

    public NodeId getRoot() {
        return mRoot;
    }

    public boolean contains(NodeId id) {
        return id != null && mNodes.containsKey(id);
    }

    /**
     * Returns the number of nodes, carriers included.
     */
    public int size() {
        return mNodes.size();
    }

    /**
     * @throws UnknownNodeException if id is not in this graph
     */
    public Node get(NodeId id) throws UnknownNodeException {
        if (id == null) {
            throw new IllegalArgumentException("Node id cannot be null");
        }
        Node node = mNodes.get(id);
        if (node == null) {
            throw new UnknownNodeException(id);
        }
        return node;
    }

    /**
     * Returns the node for the given id, but fails if it is a carrier.
     *
     * @param usage describes the role the node was passed in, for the
     * exception message
     */
    public Node getOrdinary(NodeId id, String usage) throws UnknownNodeException {
        Node node = get(id);
        if (node.isCarrier()) {
            throw new IllegalCarrierUseException(id, usage);
        }
        return node;
    }

    /**
     * Adds a new node below the given generator. The new node's resolved
     * ancestors are left empty; the caller must synthesize them before
     * exposing the node.
     *
     * @throws UnknownNodeException if the generator or any explicit ancestor
     * is not in this graph
     * @throws CycleDetectedException if the generator chain is corrupt
     */
    public NodeId createNode(NodeId generator, String name, List<NodeId> explicitAncestors)
        throws UnknownNodeException, CycleDetectedException
    {
        if (generator == null) {
            throw new IllegalArgumentException("Generator cannot be null");
        }
        Node gen = getOrdinary(generator, "a generator");
        for (NodeId ancestor : explicitAncestors) {
            getOrdinary(ancestor, "an explicit ancestor");
        }

        // Walk the chain fully, which fails if it loops or dangles.
        getGeneratorChain(generator);

        NodeId id = nextId();
        mNodes.put(id, new Node(id, name, generator, explicitAncestors));
        gen.addInstance(id);
        return id;
    }

    /**
     * Adds a carrier for the given owner and potency. Carriers have no
     * generator and are not listed as instances of anything.
     */
    NodeId createCarrier(NodeId owner, int potency) throws UnknownNodeException {
        getOrdinary(owner, "a carrier owner");
        NodeId id = nextId();
        mNodes.put(id, new Node(id, null, null, owner, potency));
        return id;
    }

    /**
     * Removes a node outright, unlinking it from its generator's instances.
     * Only used to withdraw a node or carrier whose creating operation
     * failed, before anything else could refer to it.
     */
    public void discard(NodeId id) {
        Node node = mNodes.remove(id);
        if (node != null && node.getGenerator() != null) {
            Node gen = mNodes.get(node.getGenerator());
            if (gen != null) {
                gen.removeInstance(id);
            }
        }
    }

    /**
     * Installs a node as given, replacing any node with the same id. No
     * validation is performed, and the reverse instance index is left alone.
     */
    void replace(Node node) {
        mNodes.put(node.getId(), node);
    }

    /**
     * Returns the instantiation lineage of a node, nearest generator first and
     * root last. The root and carriers have an empty chain.
     *
     * @throws UnknownNodeException if node or any generator on its chain is
     * not in this graph
     * @throws CycleDetectedException if the chain revisits a node
     */
    public List<NodeId> getGeneratorChain(NodeId id)
        throws UnknownNodeException, CycleDetectedException
    {
        Node node = get(id);
        List<NodeId> chain = new ArrayList<NodeId>();
        Set<NodeId> seen = new HashSet<NodeId>();
        seen.add(id);
        NodeId generator;
        while ((generator = node.getGenerator()) != null) {
            if (!seen.add(generator)) {
                throw new CycleDetectedException
                    (generator, "Generator chain of " + id + " revisits " + generator);
            }
            chain.add(generator);
            node = get(generator);
        }
        return chain;
    }

    public void setResolvedAncestors(NodeId id, List<NodeId> ancestors)
        throws UnknownNodeException
    {
        get(id).setResolvedAncestors(ancestors);
    }

    public List<NodeId> getResolvedAncestors(NodeId id) throws UnknownNodeException {
        return get(id).getResolvedAncestors();
    }

    public void setExplicitAncestors(NodeId id, List<NodeId> ancestors)
        throws UnknownNodeException
    {
        get(id).setExplicitAncestors(ancestors);
    }

    public List<NodeId> getExplicitAncestors(NodeId id) throws UnknownNodeException {
        return get(id).getExplicitAncestors();
    }

    public List<Declaration> getDeclarations(NodeId id) throws UnknownNodeException {
        return get(id).getDeclarations();
    }

    public List<NodeId> getInstances(NodeId id) throws UnknownNodeException {
        return get(id).getInstances();
    }

    void addDeclaration(NodeId holder, Declaration decl) throws UnknownNodeException {
        get(holder).addDeclaration(decl);
    }

    void removeDeclaration(NodeId holder, Declaration decl) {
        Node node = mNodes.get(holder);
        if (node != null) {
            node.removeDeclaration(decl);
        }
    }

    private NodeId nextId() {
        return new NodeId(mNextId++);
    }
}
