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

import java.util.HashMap;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import com.amazon.clabject.Declaration;
import com.amazon.clabject.DeclarationId;
import com.amazon.clabject.DeclarationScope;
import com.amazon.clabject.FeatureKind;
import com.amazon.clabject.NodeId;
import com.amazon.clabject.PropagationFailedException;
import com.amazon.clabject.UnknownNodeException;

/**
 * Records declarations upon their holders. Object and instance scoped
 * declarations are held by the declaring node. Deep declarations are held by
 * the carrier for the owner and potency pair, and trigger propagation to the
 * owner's existing descendants.
 *
 * <p>DeclarationStore is not thread-safe. Callers must serialize access.
 *
 * @author Brian S O'Neill
 */
public class DeclarationStore {
    private final Log mLog = LogFactory.getLog(DeclarationStore.class);

    private final NodeGraph mGraph;
    private final CarrierPool mCarriers;
    private final PropagationEngine mEngine;

    private final Map<DeclarationId, Declaration> mDeclarations;
    private long mNextId;

    public DeclarationStore(NodeGraph graph, CarrierPool carriers, PropagationEngine engine) {
        mGraph = graph;
        mCarriers = carriers;
        mEngine = engine;
        mDeclarations = new HashMap<DeclarationId, Declaration>();
    }

    /**
     * @throws InvalidPotencyException if potency is negative
     * @throws IllegalCarrierUseException if owner is a carrier
     * @throws UnknownNodeException if owner is not in the graph
     * @throws PropagationFailedException if descendants could not be updated,
     * in which case the declaration is withdrawn
     */
    public Declaration declare(NodeId owner, String name, FeatureKind kind, int potency,
                               Object payload)
        throws UnknownNodeException, PropagationFailedException
    {
        if (name == null) {
            throw new IllegalArgumentException("Feature name cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Feature kind cannot be null");
        }
        DeclarationScope scope = DeclarationScope.forPotency(potency);
        mGraph.getOrdinary(owner, "a declaration owner");

        if (scope != DeclarationScope.DEEP) {
            Declaration decl = newDeclaration(owner, owner, name, kind, potency, payload);
            mGraph.addDeclaration(owner, decl);
            mDeclarations.put(decl.getId(), decl);
            return decl;
        }

        boolean created = mCarriers.peek(owner, potency) == null;
        NodeId carrier = mCarriers.get(owner, potency);
        Declaration decl = newDeclaration(owner, carrier, name, kind, potency, payload);
        mGraph.addDeclaration(carrier, decl);

        try {
            mEngine.propagateFrom(owner);
        } catch (PropagationFailedException e) {
            mGraph.removeDeclaration(carrier, decl);
            if (created) {
                mCarriers.remove(owner, potency);
            }
            mLog.warn("Withdrew declaration " + decl + " after failed propagation", e);
            throw e;
        }

        mDeclarations.put(decl.getId(), decl);
        return decl;
    }

    /**
     * Returns a declaration by id, or null if not found.
     */
    public Declaration get(DeclarationId id) {
        return mDeclarations.get(id);
    }

    public int size() {
        return mDeclarations.size();
    }

    private Declaration newDeclaration(NodeId owner, NodeId holder, String name,
                                       FeatureKind kind, int potency, Object payload)
    {
        return new Declaration(new DeclarationId(mNextId++), owner, holder,
                               name, kind, potency, payload);
    }
}
