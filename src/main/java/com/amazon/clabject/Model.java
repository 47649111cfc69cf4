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

import java.util.List;

/**
 * A Model is an open ended chain of instantiation levels. Every node is both a
 * type and an instance: it was produced by its <i>generator</i>, and it can
 * produce further nodes. All generator chains end at a single root node,
 * created along with the model.
 *
 * <p>Declarations carry a <i>potency</i>, which controls how many
 * instantiation levels must elapse before the declaration becomes a concrete
 * member:
 *
 * <ul>
 * <li>potency 0 declarations are visible only on the declaring node
 * <li>potency 1 declarations are visible on direct instances, and below
 * <li>potency <i>p</i> &ge; 2 declarations are invisible at every node closer
 * than <i>p</i> levels to the declaring node, and concrete at every node
 * <i>p</i> or more levels below it
 * </ul>
 *
 * Declarations may be added at any time. Nodes which already exist observe new
 * deep declarations as soon as {@link #declare declare} returns, and nodes
 * created later observe every declaration made before them.
 *
 * <p>Model instances are thread-safe unless built otherwise. Each mutating
 * operation runs to completion as a single critical section.
 *
 * @author Brian S O'Neill
 * @see ModelBuilder
 */
public interface Model {
    /**
     * Returns the name of this model.
     */
    String getName();

    /**
     * Returns the root node, at which every generator chain ends.
     */
    NodeId getRoot();

    /**
     * Instantiates a new node from the given generator. The new node's
     * resolved ancestors are computed before this method returns, and so it
     * immediately sees every deep feature declared by its generator chain.
     *
     * @param generator existing node to instantiate
     * @param name optional display name, which may be null
     * @param explicitAncestors optional owner chosen ancestors, in precedence
     * order, which take priority over the generator
     * @return id of the new node
     * @throws IllegalArgumentException if generator is null
     * @throws IllegalCarrierUseException if generator or any explicit ancestor
     * is a carrier
     * @throws UnknownNodeException if generator or any explicit ancestor is
     * not in this model
     * @throws CycleDetectedException if the generator chain is corrupt
     */
    NodeId createNode(NodeId generator, String name, NodeId... explicitAncestors)
        throws UnknownNodeException, CycleDetectedException;

    /**
     * Declares a feature upon a node.
     *
     * <p>Deep declarations, with potency two or more, are recorded on the
     * carrier for the owner and potency pair, and are propagated to every
     * existing descendant of the owner before this method returns. If
     * propagation fails, the declaration is withdrawn.
     *
     * @param owner node to declare upon
     * @param name feature name
     * @param kind feature kind
     * @param potency non-negative potency
     * @param payload feature behavior or shape, opaque to the model
     * @return id of the new declaration
     * @throws InvalidPotencyException if potency is negative
     * @throws IllegalCarrierUseException if owner is a carrier
     * @throws UnknownNodeException if owner is not in this model
     * @throws PropagationFailedException if descendants could not be updated
     */
    DeclarationId declare(NodeId owner, String name, FeatureKind kind, int potency,
                          Object payload)
        throws UnknownNodeException, PropagationFailedException;

    /**
     * Looks up a feature, walking the node's own declarations and then its
     * resolved ancestors in order. The first visible declaration wins.
     *
     * @throws FeatureNotFoundException if no visible declaration matches
     * @throws UnknownNodeException if node is not in this model
     */
    Declaration resolve(NodeId node, String name)
        throws FeatureNotFoundException, UnknownNodeException;

    /**
     * Looks up a feature like {@link #resolve resolve}, except it returns null
     * if no visible declaration matches.
     *
     * @throws UnknownNodeException if node is not in this model
     */
    Declaration tryResolve(NodeId node, String name) throws UnknownNodeException;

    /**
     * Looks up a feature of a specific kind. Declarations of other kinds are
     * skipped, even if they have the same name.
     *
     * @param kind required feature kind, or null to accept any
     * @return matching declaration, or null if none
     * @throws UnknownNodeException if node is not in this model
     */
    Declaration tryResolve(NodeId node, String name, FeatureKind kind)
        throws UnknownNodeException;

    /**
     * Returns the instantiation lineage of a node, nearest generator first and
     * root last. The root's chain is empty.
     *
     * @throws UnknownNodeException if node is not in this model
     * @throws CycleDetectedException if the generator chain is corrupt
     */
    List<NodeId> generatorChain(NodeId node)
        throws UnknownNodeException, CycleDetectedException;

    /**
     * Returns the order in which nodes are searched when resolving features
     * on the given node, starting with the node itself.
     *
     * @throws UnknownNodeException if node is not in this model
     */
    List<NodeId> lookupOrder(NodeId node) throws UnknownNodeException;

    /**
     * Returns the synthesized ancestor list of a node, which is the
     * authoritative lookup order beyond the node itself.
     *
     * @throws UnknownNodeException if node is not in this model
     */
    List<NodeId> getResolvedAncestors(NodeId node) throws UnknownNodeException;

    /**
     * Returns the owner chosen ancestors of a node, which may be empty.
     *
     * @throws UnknownNodeException if node is not in this model
     */
    List<NodeId> getExplicitAncestors(NodeId node) throws UnknownNodeException;

    /**
     * Replaces the owner chosen ancestors of a node, and recomputes its
     * resolved ancestors.
     *
     * @throws IllegalArgumentException if node is the root, or if an ancestor
     * is the node itself
     * @throws IllegalCarrierUseException if node or any ancestor is a carrier
     * @throws UnknownNodeException if any node is not in this model
     * @throws CycleDetectedException if an ancestor already reaches node in
     * its lookup order
     */
    void setExplicitAncestors(NodeId node, NodeId... explicitAncestors)
        throws UnknownNodeException, CycleDetectedException;

    /**
     * Recomputes the resolved ancestors of every descendant of the given node,
     * but not of the node itself. Declaring deep features does this
     * automatically; calling it again has no effect.
     *
     * @throws UnknownNodeException if node is not in this model
     * @throws PropagationFailedException if any descendant could not be
     * updated, in which case none were
     */
    void propagateFrom(NodeId node) throws UnknownNodeException, PropagationFailedException;

    /**
     * Returns the direct instances of a node, in creation order.
     *
     * @throws UnknownNodeException if node is not in this model
     */
    List<NodeId> getInstances(NodeId node) throws UnknownNodeException;

    /**
     * Returns the declarations held directly by a node or carrier, in
     * declaration order.
     *
     * @throws UnknownNodeException if node is not in this model
     */
    List<Declaration> getDeclarations(NodeId node) throws UnknownNodeException;

    /**
     * Returns a declaration by id, or null if this model never issued it.
     */
    Declaration getDeclaration(DeclarationId id);

    /**
     * Returns the number of generator links between a node and the root. The
     * root and carriers have depth zero.
     *
     * @throws UnknownNodeException if node is not in this model
     * @throws CycleDetectedException if the generator chain is corrupt
     */
    int getDepth(NodeId node) throws UnknownNodeException, CycleDetectedException;

    /**
     * Returns the display name given to a node, or null if none.
     *
     * @throws UnknownNodeException if node is not in this model
     */
    String getNodeName(NodeId node) throws UnknownNodeException;

    /**
     * Returns true if the given node is a carrier of deep declarations.
     *
     * @throws UnknownNodeException if node is not in this model
     */
    boolean isCarrier(NodeId node) throws UnknownNodeException;

    /**
     * Returns the carrier holding the given owner's declarations of the given
     * potency, or null if none has been created.
     *
     * @throws InvalidPotencyException if potency is negative
     * @throws UnknownNodeException if owner is not in this model
     */
    NodeId getCarrier(NodeId owner, int potency) throws UnknownNodeException;
}
