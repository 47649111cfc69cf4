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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.amazon.clabject.CycleDetectedException;
import com.amazon.clabject.NodeId;
import com.amazon.clabject.UnknownNodeException;

/**
 * Produces the resolved ancestor list of a node by merging, in precedence
 * order:
 *
 * <ol>
 * <li>the node's explicit, owner chosen ancestors
 * <li>the carriers due at the node, nearest owner first
 * <li>the node's generator, as the structural default
 * </ol>
 *
 * The merged list keeps the first occurrence of each node and never contains
 * the node itself. The root has no generator and resolves to its explicit
 * ancestors only, which are always empty.
 *
 * @author Brian S O'Neill
 */
public class AncestorSynthesizer {
    private final NodeGraph mGraph;
    private final PotencyResolver mResolver;

    public AncestorSynthesizer(NodeGraph graph, PotencyResolver resolver) {
        mGraph = graph;
        mResolver = resolver;
    }

    /**
     * Computes the resolved ancestors of a node without committing them.
     *
     * @throws UnknownNodeException if node or any node it refers to is not in
     * the graph
     * @throws CycleDetectedException if the generator chain revisits a node
     */
    public List<NodeId> synthesize(NodeId id)
        throws UnknownNodeException, CycleDetectedException
    {
        Node node = mGraph.get(id);

        Set<NodeId> merged = new LinkedHashSet<NodeId>();
        for (NodeId ancestor : node.getExplicitAncestors()) {
            // Fails on a dangling ancestor.
            mGraph.get(ancestor);
            merged.add(ancestor);
        }
        merged.addAll(mResolver.carriersFor(id));
        if (node.getGenerator() != null) {
            merged.add(node.getGenerator());
        }
        merged.remove(id);

        return new ArrayList<NodeId>(merged);
    }

    /**
     * Computes the resolved ancestors of a node and commits them to the
     * graph.
     *
     * @return the committed list
     */
    public List<NodeId> commit(NodeId id) throws UnknownNodeException, CycleDetectedException {
        List<NodeId> ancestors = synthesize(id);
        mGraph.setResolvedAncestors(id, ancestors);
        return ancestors;
    }
}
