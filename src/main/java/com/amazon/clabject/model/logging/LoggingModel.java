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

package com.amazon.clabject.model.logging;

import java.util.Arrays;
import java.util.List;

import com.amazon.clabject.CycleDetectedException;
import com.amazon.clabject.Declaration;
import com.amazon.clabject.DeclarationId;
import com.amazon.clabject.FeatureKind;
import com.amazon.clabject.FeatureNotFoundException;
import com.amazon.clabject.Model;
import com.amazon.clabject.NodeId;
import com.amazon.clabject.PropagationFailedException;
import com.amazon.clabject.UnknownNodeException;

/**
 * Model wrapper which writes every mutating call, and every resolution, to a
 * {@link Log} before passing it along. Pure introspection calls are passed
 * along silently.
 *
 * @author Brian S O'Neill
 */
class LoggingModel implements Model {
    private final Model mModel;
    private final Log mLog;

    LoggingModel(Model actual, Log log) {
        mModel = actual;
        mLog = log;
    }

    public String getName() {
        return mModel.getName();
    }

    public NodeId getRoot() {
        return mModel.getRoot();
    }

    public NodeId createNode(NodeId generator, String name, NodeId... explicitAncestors)
        throws UnknownNodeException, CycleDetectedException
    {
        NodeId id = mModel.createNode(generator, name, explicitAncestors);
        if (mLog.isEnabled()) {
            StringBuilder b = new StringBuilder();
            b.append("Model.createNode(").append(generator);
            if (name != null) {
                b.append(", \"").append(name).append('"');
            }
            if (explicitAncestors != null && explicitAncestors.length > 0) {
                b.append(", ").append(Arrays.asList(explicitAncestors));
            }
            b.append(") returned ").append(id);
            mLog.write(b.toString());
        }
        return id;
    }

    public DeclarationId declare(NodeId owner, String name, FeatureKind kind, int potency,
                                 Object payload)
        throws UnknownNodeException, PropagationFailedException
    {
        if (mLog.isEnabled()) {
            mLog.write("Model.declare(" + owner + ", \"" + name + "\", " + kind +
                       ", " + potency + ')');
        }
        return mModel.declare(owner, name, kind, potency, payload);
    }

    public Declaration resolve(NodeId node, String name)
        throws FeatureNotFoundException, UnknownNodeException
    {
        if (mLog.isEnabled()) {
            mLog.write("Model.resolve(" + node + ", \"" + name + "\")");
        }
        return mModel.resolve(node, name);
    }

    public Declaration tryResolve(NodeId node, String name) throws UnknownNodeException {
        if (mLog.isEnabled()) {
            mLog.write("Model.tryResolve(" + node + ", \"" + name + "\")");
        }
        return mModel.tryResolve(node, name);
    }

    public Declaration tryResolve(NodeId node, String name, FeatureKind kind)
        throws UnknownNodeException
    {
        if (mLog.isEnabled()) {
            mLog.write("Model.tryResolve(" + node + ", \"" + name + "\", " + kind + ')');
        }
        return mModel.tryResolve(node, name, kind);
    }

    public List<NodeId> generatorChain(NodeId node)
        throws UnknownNodeException, CycleDetectedException
    {
        return mModel.generatorChain(node);
    }

    public List<NodeId> lookupOrder(NodeId node) throws UnknownNodeException {
        return mModel.lookupOrder(node);
    }

    public List<NodeId> getResolvedAncestors(NodeId node) throws UnknownNodeException {
        return mModel.getResolvedAncestors(node);
    }

    public List<NodeId> getExplicitAncestors(NodeId node) throws UnknownNodeException {
        return mModel.getExplicitAncestors(node);
    }

    public void setExplicitAncestors(NodeId node, NodeId... explicitAncestors)
        throws UnknownNodeException, CycleDetectedException
    {
        if (mLog.isEnabled()) {
            mLog.write("Model.setExplicitAncestors(" + node + ", " +
                       (explicitAncestors == null ? "[]" : Arrays.asList(explicitAncestors)) +
                       ')');
        }
        mModel.setExplicitAncestors(node, explicitAncestors);
    }

    public void propagateFrom(NodeId node)
        throws UnknownNodeException, PropagationFailedException
    {
        if (mLog.isEnabled()) {
            mLog.write("Model.propagateFrom(" + node + ')');
        }
        mModel.propagateFrom(node);
    }

    public List<NodeId> getInstances(NodeId node) throws UnknownNodeException {
        return mModel.getInstances(node);
    }

    public List<Declaration> getDeclarations(NodeId node) throws UnknownNodeException {
        return mModel.getDeclarations(node);
    }

    public Declaration getDeclaration(DeclarationId id) {
        return mModel.getDeclaration(id);
    }

    public int getDepth(NodeId node) throws UnknownNodeException, CycleDetectedException {
        return mModel.getDepth(node);
    }

    public String getNodeName(NodeId node) throws UnknownNodeException {
        return mModel.getNodeName(node);
    }

    public boolean isCarrier(NodeId node) throws UnknownNodeException {
        return mModel.isCarrier(node);
    }

    public NodeId getCarrier(NodeId owner, int potency) throws UnknownNodeException {
        return mModel.getCarrier(owner, potency);
    }

    @Override
    public String toString() {
        return "LoggingModel {actual=" + mModel + '}';
    }
}
