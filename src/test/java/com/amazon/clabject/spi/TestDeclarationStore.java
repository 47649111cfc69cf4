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

import java.util.Arrays;

import junit.framework.TestCase;
import junit.framework.TestSuite;

import com.amazon.clabject.Declaration;
import com.amazon.clabject.DeclarationScope;
import com.amazon.clabject.FeatureKind;
import com.amazon.clabject.IllegalCarrierUseException;
import com.amazon.clabject.InvalidPotencyException;
import com.amazon.clabject.NodeId;
import com.amazon.clabject.PropagationFailedException;

/**
 *
 *
 * @author Brian S O'Neill
 */
public class TestDeclarationStore extends TestCase {
    public static void main(String[] args) {
        junit.textui.TestRunner.run(suite());
    }

    public static TestSuite suite() {
        return new TestSuite(TestDeclarationStore.class);
    }

    private NodeGraph mGraph;
    private CarrierPool mCarriers;
    private AncestorSynthesizer mSynthesizer;
    private DeclarationStore mStore;

    public TestDeclarationStore(String name) {
        super(name);
    }

    protected void setUp() {
        mGraph = new NodeGraph("Root");
        mCarriers = new CarrierPool(mGraph);
        mSynthesizer = new AncestorSynthesizer(mGraph, new PotencyResolver(mGraph, mCarriers));
        mStore = new DeclarationStore
            (mGraph, mCarriers, new PropagationEngine(mGraph, mSynthesizer));
    }

    private NodeId create(NodeId generator, String name, NodeId... explicit) throws Exception {
        NodeId id = mGraph.createNode(generator, name, Arrays.asList(explicit));
        mSynthesizer.commit(id);
        return id;
    }

    public void testShallow() throws Exception {
        NodeId a = create(mGraph.getRoot(), "A");
        Declaration count = mStore.declare(a, "count", FeatureKind.PROPERTY, 0, null);
        Declaration name = mStore.declare(a, "name", FeatureKind.PROPERTY, 1, null);

        assertEquals(DeclarationScope.OBJECT, count.getScope());
        assertEquals(DeclarationScope.INSTANCE, name.getScope());
        assertEquals(a, count.getHolder());
        assertEquals(a, name.getHolder());
        assertEquals(Arrays.asList(count, name), mGraph.getDeclarations(a));
        assertEquals(0, mCarriers.size());
        assertEquals(2, mStore.size());
        assertEquals(name, mStore.get(name.getId()));
    }

    public void testDeep() throws Exception {
        NodeId a = create(mGraph.getRoot(), "A");
        NodeId b = create(a, "B");
        NodeId c = create(b, "C");

        Declaration price = mStore.declare(a, "price", FeatureKind.PROPERTY, 2, "p");
        NodeId carrier = mCarriers.peek(a, 2);
        assertEquals(carrier, price.getHolder());
        assertEquals(a, price.getOwner());
        assertTrue(mGraph.getDeclarations(a).isEmpty());
        assertEquals(Arrays.asList(price), mGraph.getDeclarations(carrier));
        assertEquals(Arrays.asList(carrier, b), mGraph.getResolvedAncestors(c));

        Declaration discount = mStore.declare(a, "discount", FeatureKind.METHOD, 2, "d");
        assertEquals(carrier, discount.getHolder());
        assertEquals(1, mCarriers.size());
    }

    public void testRejected() throws Exception {
        NodeId a = create(mGraph.getRoot(), "A");
        try {
            mStore.declare(a, "bad", FeatureKind.PROPERTY, -2, null);
            fail();
        } catch (InvalidPotencyException e) {
            assertEquals(-2, e.getPotency());
        }

        mStore.declare(a, "price", FeatureKind.PROPERTY, 2, null);
        try {
            mStore.declare(mCarriers.peek(a, 2), "x", FeatureKind.PROPERTY, 2, null);
            fail();
        } catch (IllegalCarrierUseException e) {
        }
        assertEquals(1, mStore.size());
        assertEquals(1, mCarriers.size());
    }

    public void testRollbackNewCarrier() throws Exception {
        NodeId root = mGraph.getRoot();
        NodeId a = create(root, "A");
        NodeId x = create(root, "X");
        create(a, "B", x);
        mGraph.discard(x);
        int size = mGraph.size();

        try {
            mStore.declare(a, "price", FeatureKind.PROPERTY, 2, "p");
            fail();
        } catch (PropagationFailedException e) {
            assertEquals(a, e.getOrigin());
        }

        assertNull(mCarriers.peek(a, 2));
        assertEquals(size, mGraph.size());
        assertEquals(0, mStore.size());
    }

    public void testRollbackExistingCarrier() throws Exception {
        NodeId root = mGraph.getRoot();
        NodeId a = create(root, "A");
        NodeId x = create(root, "X");
        Declaration price = mStore.declare(a, "price", FeatureKind.PROPERTY, 2, "p");
        NodeId carrier = mCarriers.peek(a, 2);

        create(a, "B", x);
        mGraph.discard(x);

        try {
            mStore.declare(a, "tax", FeatureKind.PROPERTY, 2, "t");
            fail();
        } catch (PropagationFailedException e) {
        }

        assertEquals(carrier, mCarriers.peek(a, 2));
        assertEquals(Arrays.asList(price), mGraph.getDeclarations(carrier));
        assertEquals(1, mStore.size());
    }
}
