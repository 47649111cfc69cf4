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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import junit.framework.TestCase;

/**
 * Runs an extensive set of acceptance tests for a model. Must be subclassed
 * to specify a model to use.
 *
 * @author Don Schneider
 * @author Brian S O'Neill
 */
public abstract class TestModel extends TestCase {

    private Model mModel;
    private NodeId mRoot;

    public TestModel(String name) {
        super(name);
    }

    @Override
    protected void setUp() throws Exception {
        super.setUp();
        mModel = newModel();
        mRoot = mModel.getRoot();
    }

    @Override
    protected void tearDown() throws Exception {
        super.tearDown();
        mModel = null;
        mRoot = null;
    }

    /**
     * Subclasses must implement this method to specify a fresh model to run
     * each test against.
     */
    protected abstract Model newModel() throws Exception;

    protected Model getModel() {
        return mModel;
    }

    public void test_priceScenario() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        mModel.declare(a, "price", FeatureKind.PROPERTY, 2, "price-payload");
        NodeId b = mModel.createNode(a, "B");
        NodeId c = mModel.createNode(b, "C");

        assertNull(mModel.tryResolve(b, "price"));
        try {
            mModel.resolve(b, "price");
            fail();
        } catch (FeatureNotFoundException e) {
            assertEquals(b, e.getNode());
            assertEquals("price", e.getFeatureName());
        }

        Declaration decl = mModel.resolve(c, "price");
        assertEquals("price-payload", decl.getPayload());
        assertEquals(a, decl.getOwner());
        assertEquals(2, decl.getPotency());
        assertEquals(DeclarationScope.DEEP, decl.getScope());
        assertEquals(mModel.getCarrier(a, 2), decl.getHolder());
        assertTrue(mModel.isCarrier(decl.getHolder()));
    }

    public void test_countScenario() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        mModel.declare(a, "count", FeatureKind.PROPERTY, 0, "count-payload");
        NodeId b = mModel.createNode(a, "B");
        NodeId c = mModel.createNode(b, "C");

        Declaration decl = mModel.resolve(a, "count");
        assertEquals("count-payload", decl.getPayload());
        assertEquals(DeclarationScope.OBJECT, decl.getScope());
        assertEquals(a, decl.getHolder());

        assertNull(mModel.tryResolve(b, "count"));
        assertNull(mModel.tryResolve(c, "count"));
        assertNull(mModel.getCarrier(a, 2));
    }

    public void test_instanceScope() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        mModel.declare(a, "name", FeatureKind.PROPERTY, 1, "name-payload");

        NodeId node = a;
        for (int depth=1; depth<=4; depth++) {
            node = mModel.createNode(node, null);
            Declaration decl = mModel.resolve(node, "name");
            assertEquals("name-payload", decl.getPayload());
            assertEquals(a, decl.getHolder());
        }

        // Not a member of the declaring node itself.
        assertNull(mModel.tryResolve(a, "name"));
        try {
            mModel.resolve(a, "name");
            fail();
        } catch (FeatureNotFoundException e) {
            assertEquals(a, e.getNode());
        }
        assertNull(mModel.tryResolve(mRoot, "name"));
        assertNull(mModel.getCarrier(a, 1));
    }

    public void test_depthExactness() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        mModel.declare(a, "price", FeatureKind.PROPERTY, 2, "p");

        NodeId b1 = mModel.createNode(a, "B1");
        NodeId b2 = mModel.createNode(a, "B2");
        assertNull(mModel.tryResolve(a, "price"));
        assertNull(mModel.tryResolve(b1, "price"));
        assertNull(mModel.tryResolve(b2, "price"));

        NodeId c1 = mModel.createNode(b1, "C1");
        NodeId c2 = mModel.createNode(b2, "C2");
        NodeId d = mModel.createNode(c1, "D");
        NodeId e = mModel.createNode(d, "E");
        for (NodeId node : Arrays.asList(c1, c2, d, e)) {
            assertEquals("p", mModel.resolve(node, "price").getPayload());
        }
    }

    public void test_everyPotency() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        for (int p=0; p<=5; p++) {
            mModel.declare(a, "f" + p, FeatureKind.PROPERTY, p, Integer.valueOf(p));
        }

        List<NodeId> levels = new ArrayList<NodeId>();
        levels.add(a);
        for (int depth=1; depth<=7; depth++) {
            levels.add(mModel.createNode(levels.get(depth - 1), "L-" + depth));
        }

        for (int depth=0; depth<=7; depth++) {
            NodeId node = levels.get(depth);
            for (int p=1; p<=5; p++) {
                Declaration decl = mModel.tryResolve(node, "f" + p);
                if (depth >= p) {
                    assertNotNull("depth " + depth + ", potency " + p, decl);
                    assertEquals(Integer.valueOf(p), decl.getPayload());
                } else {
                    assertNull("depth " + depth + ", potency " + p, decl);
                }
            }
            if (depth == 0) {
                assertEquals(Integer.valueOf(0), mModel.resolve(node, "f0").getPayload());
            } else {
                assertNull(mModel.tryResolve(node, "f0"));
            }
        }
    }

    public void test_ownerSeesOnlyObjectScope() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        mModel.declare(a, "name", FeatureKind.PROPERTY, 1, "instance");
        mModel.declare(a, "price", FeatureKind.PROPERTY, 2, "deep");
        mModel.declare(a, "size", FeatureKind.PROPERTY, 0, "object");

        assertNull(mModel.tryResolve(a, "name"));
        assertNull(mModel.tryResolve(a, "price"));
        assertEquals("object", mModel.resolve(a, "size").getPayload());

        // An object scoped redeclaration is found on the owner, while the
        // instance scoped one is still what instances inherit.
        mModel.declare(a, "name", FeatureKind.PROPERTY, 0, "own");
        NodeId b = mModel.createNode(a, "B");
        assertEquals("own", mModel.resolve(a, "name").getPayload());
        assertEquals("instance", mModel.resolve(b, "name").getPayload());
    }

    public void test_dynamicAddition() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        NodeId b = mModel.createNode(a, "B");
        NodeId c = mModel.createNode(b, "C");
        NodeId d = mModel.createNode(c, "D");
        NodeId b2 = mModel.createNode(a, "B2");
        NodeId c2 = mModel.createNode(b2, "C2");

        mModel.declare(a, "price", FeatureKind.PROPERTY, 2, "p");

        assertNull(mModel.tryResolve(b, "price"));
        assertNull(mModel.tryResolve(b2, "price"));
        assertEquals("p", mModel.resolve(c, "price").getPayload());
        assertEquals("p", mModel.resolve(c2, "price").getPayload());
        assertEquals("p", mModel.resolve(d, "price").getPayload());

        mModel.declare(a, "tax", FeatureKind.PROPERTY, 3, "t");

        assertNull(mModel.tryResolve(c, "tax"));
        assertEquals("t", mModel.resolve(d, "tax").getPayload());
    }

    public void test_newLevelExtension() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        NodeId b = mModel.createNode(a, "B");
        NodeId c = mModel.createNode(b, "C");
        mModel.declare(a, "price", FeatureKind.PROPERTY, 2, "p");
        mModel.declare(a, "weight", FeatureKind.PROPERTY, 4, "w");
        mModel.declare(b, "size", FeatureKind.PROPERTY, 3, "s");

        NodeId d = mModel.createNode(c, "D");
        assertEquals("p", mModel.resolve(d, "price").getPayload());
        assertNull(mModel.tryResolve(d, "weight"));
        assertNull(mModel.tryResolve(d, "size"));

        NodeId e = mModel.createNode(d, "E");
        assertEquals("p", mModel.resolve(e, "price").getPayload());
        assertEquals("w", mModel.resolve(e, "weight").getPayload());
        assertEquals("s", mModel.resolve(e, "size").getPayload());
    }

    public void test_idempotentPropagation() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        NodeId b = mModel.createNode(a, "B");
        NodeId c = mModel.createNode(b, "C");
        NodeId d = mModel.createNode(c, "D");
        NodeId c2 = mModel.createNode(b, "C2", a);
        mModel.declare(a, "price", FeatureKind.PROPERTY, 2, "p");
        mModel.declare(a, "tax", FeatureKind.PROPERTY, 3, "t");

        List<NodeId> nodes = Arrays.asList(b, c, d, c2);
        Map<NodeId, List<NodeId>> before = new HashMap<NodeId, List<NodeId>>();
        for (NodeId node : nodes) {
            before.put(node, new ArrayList<NodeId>(mModel.getResolvedAncestors(node)));
        }

        mModel.propagateFrom(a);
        mModel.propagateFrom(a);

        for (NodeId node : nodes) {
            assertEquals(before.get(node), mModel.getResolvedAncestors(node));
        }
    }

    public void test_propagationLeavesOriginAlone() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        List<NodeId> original = new ArrayList<NodeId>(mModel.getResolvedAncestors(a));
        mModel.propagateFrom(a);
        assertEquals(original, mModel.getResolvedAncestors(a));
        assertEquals(Arrays.asList(mRoot), original);
    }

    public void test_carrierReuse() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        mModel.declare(a, "price", FeatureKind.PROPERTY, 2, "p");
        NodeId carrier = mModel.getCarrier(a, 2);
        assertNotNull(carrier);

        mModel.declare(a, "discount", FeatureKind.METHOD, 2, "d");
        assertEquals(carrier, mModel.getCarrier(a, 2));
        assertEquals(2, mModel.getDeclarations(carrier).size());
        assertTrue(mModel.getDeclarations(a).isEmpty());

        mModel.declare(a, "tax", FeatureKind.PROPERTY, 3, "t");
        NodeId carrier3 = mModel.getCarrier(a, 3);
        assertNotNull(carrier3);
        assertFalse(carrier.equals(carrier3));

        assertNull(mModel.getCarrier(a, 4));
        assertTrue(mModel.getInstances(a).isEmpty());
        assertTrue(mModel.getResolvedAncestors(carrier).isEmpty());
        assertTrue(mModel.generatorChain(carrier).isEmpty());
    }

    public void test_nearestCarrierFirst() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        NodeId b = mModel.createNode(a, "B");
        NodeId c = mModel.createNode(b, "C");
        mModel.declare(a, "label", FeatureKind.PROPERTY, 3, "from A");
        mModel.declare(b, "label", FeatureKind.PROPERTY, 2, "from B");
        NodeId d = mModel.createNode(c, "D");

        List<NodeId> expected = Arrays.asList(mModel.getCarrier(b, 2), mModel.getCarrier(a, 3), c);
        assertEquals(expected, mModel.getResolvedAncestors(d));

        Declaration decl = mModel.resolve(d, "label");
        assertEquals("from B", decl.getPayload());
        assertEquals(b, decl.getOwner());
    }

    public void test_explicitAncestorPrecedence() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        NodeId mixin = mModel.createNode(mRoot, "Mixin");
        mModel.declare(a, "color", FeatureKind.PROPERTY, 2, "deep");
        mModel.declare(mixin, "color", FeatureKind.PROPERTY, 1, "mixin");

        NodeId b = mModel.createNode(a, "B");
        NodeId plain = mModel.createNode(b, "Plain");
        NodeId custom = mModel.createNode(b, "Custom", mixin);

        assertEquals("deep", mModel.resolve(plain, "color").getPayload());
        assertEquals("mixin", mModel.resolve(custom, "color").getPayload());

        assertEquals(Arrays.asList(mixin), mModel.getExplicitAncestors(custom));
        assertEquals(Arrays.asList(mixin, mModel.getCarrier(a, 2), b),
                     mModel.getResolvedAncestors(custom));
    }

    public void test_explicitAncestorDeduplicated() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        NodeId other = mModel.createNode(mRoot, "Other");
        NodeId b = mModel.createNode(a, "B", a, other, a);

        assertEquals(Arrays.asList(a, other), mModel.getResolvedAncestors(b));
    }

    public void test_setExplicitAncestors() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        NodeId mixin = mModel.createNode(mRoot, "Mixin");
        mModel.declare(a, "color", FeatureKind.PROPERTY, 2, "deep");
        mModel.declare(mixin, "color", FeatureKind.PROPERTY, 1, "mixin");
        NodeId b = mModel.createNode(a, "B");
        NodeId c = mModel.createNode(b, "C");
        NodeId d = mModel.createNode(c, "D");

        mModel.setExplicitAncestors(c, mixin);
        assertEquals("mixin", mModel.resolve(c, "color").getPayload());
        assertEquals("mixin", mModel.resolve(d, "color").getPayload());

        // Survives propagation of later declarations.
        mModel.declare(a, "size", FeatureKind.PROPERTY, 2, "s");
        assertEquals(mixin, mModel.getResolvedAncestors(c).get(0));
        assertEquals("s", mModel.resolve(c, "size").getPayload());

        mModel.setExplicitAncestors(c);
        assertTrue(mModel.getExplicitAncestors(c).isEmpty());
        assertEquals("deep", mModel.resolve(c, "color").getPayload());
    }

    public void test_setExplicitAncestorsRejectsCycle() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        NodeId b = mModel.createNode(a, "B");
        NodeId x = mModel.createNode(mRoot, "X");
        mModel.setExplicitAncestors(x, b);

        try {
            mModel.setExplicitAncestors(a, x);
            fail();
        } catch (CycleDetectedException e) {
            assertEquals(a, e.getNode());
        }
        assertTrue(mModel.getExplicitAncestors(a).isEmpty());
        assertEquals(Arrays.asList(mRoot), mModel.getResolvedAncestors(a));
    }

    public void test_setExplicitAncestorsRejectsBadArguments() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        try {
            mModel.setExplicitAncestors(mRoot, a);
            fail();
        } catch (IllegalArgumentException e) {
        }
        try {
            mModel.setExplicitAncestors(a, a);
            fail();
        } catch (IllegalArgumentException e) {
        }
        try {
            mModel.setExplicitAncestors(a, (NodeId) null);
            fail();
        } catch (IllegalArgumentException e) {
        }
        try {
            mModel.setExplicitAncestors(a, new NodeId(12345));
            fail();
        } catch (UnknownNodeException e) {
            assertEquals(new NodeId(12345), e.getNode());
        }
    }

    public void test_invalidPotency() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        try {
            mModel.declare(a, "bad", FeatureKind.PROPERTY, -1, null);
            fail();
        } catch (InvalidPotencyException e) {
            assertEquals(-1, e.getPotency());
            assertEquals(1, e.getMessages().size());
        }
        assertTrue(mModel.getDeclarations(a).isEmpty());
        assertNull(mModel.tryResolve(a, "bad"));

        try {
            mModel.getCarrier(a, -3);
            fail();
        } catch (InvalidPotencyException e) {
        }
    }

    public void test_unknownNode() throws Exception {
        NodeId bogus = new NodeId(999999);
        try {
            mModel.createNode(bogus, "X");
            fail();
        } catch (UnknownNodeException e) {
            assertEquals(bogus, e.getNode());
        }
        try {
            mModel.declare(bogus, "x", FeatureKind.PROPERTY, 2, null);
            fail();
        } catch (UnknownNodeException e) {
        }
        try {
            mModel.resolve(bogus, "x");
            fail();
        } catch (UnknownNodeException e) {
        }
        try {
            mModel.generatorChain(bogus);
            fail();
        } catch (UnknownNodeException e) {
        }
        try {
            mModel.propagateFrom(bogus);
            fail();
        } catch (UnknownNodeException e) {
        }
        try {
            mModel.createNode(mRoot, "X", bogus);
            fail();
        } catch (UnknownNodeException e) {
        }
        assertTrue(mModel.getInstances(mRoot).isEmpty());
    }

    public void test_carrierMisuse() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        mModel.declare(a, "price", FeatureKind.PROPERTY, 2, "p");
        NodeId carrier = mModel.getCarrier(a, 2);

        try {
            mModel.createNode(carrier, "X");
            fail();
        } catch (IllegalCarrierUseException e) {
            assertEquals(carrier, e.getCarrier());
        }
        try {
            mModel.createNode(a, "X", carrier);
            fail();
        } catch (IllegalCarrierUseException e) {
        }
        try {
            mModel.declare(carrier, "x", FeatureKind.PROPERTY, 1, null);
            fail();
        } catch (IllegalCarrierUseException e) {
        }
        try {
            mModel.setExplicitAncestors(carrier, a);
            fail();
        } catch (IllegalCarrierUseException e) {
        }
        assertTrue(mModel.getInstances(a).isEmpty());
    }

    public void test_generatorChain() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        NodeId b = mModel.createNode(a, "B");
        NodeId c = mModel.createNode(b, "C");
        NodeId d = mModel.createNode(c, "D");

        assertEquals(Arrays.asList(c, b, a, mRoot), mModel.generatorChain(d));
        assertTrue(mModel.generatorChain(mRoot).isEmpty());
        assertEquals(4, mModel.getDepth(d));
        assertEquals(0, mModel.getDepth(mRoot));
        assertEquals(Arrays.asList(b), mModel.getInstances(a));
    }

    public void test_lookupOrder() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        mModel.declare(a, "price", FeatureKind.PROPERTY, 2, "p");
        NodeId b = mModel.createNode(a, "B");
        NodeId c = mModel.createNode(b, "C");

        NodeId carrier = mModel.getCarrier(a, 2);
        assertEquals(Arrays.asList(c, carrier, b, a, mRoot), mModel.lookupOrder(c));
        assertEquals(Arrays.asList(mRoot), mModel.lookupOrder(mRoot));
    }

    public void test_kindFilter() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        mModel.declare(a, "run", FeatureKind.METHOD, 1, "method");
        NodeId b = mModel.createNode(a, "B");

        assertNull(mModel.tryResolve(b, "run", FeatureKind.PROPERTY));
        assertEquals("method", mModel.tryResolve(b, "run", FeatureKind.METHOD).getPayload());
        assertEquals("method", mModel.tryResolve(b, "run", null).getPayload());

        mModel.declare(b, "run", FeatureKind.PROPERTY, 0, "property");
        assertEquals("property", mModel.tryResolve(b, "run").getPayload());
        assertEquals("method", mModel.tryResolve(b, "run", FeatureKind.METHOD).getPayload());
    }

    public void test_redeclarationShadows() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        DeclarationId first = mModel.declare(a, "v", FeatureKind.PROPERTY, 1, "first");
        DeclarationId second = mModel.declare(a, "v", FeatureKind.PROPERTY, 1, "second");
        NodeId b = mModel.createNode(a, "B");

        assertFalse(first.equals(second));
        assertEquals(second, mModel.resolve(b, "v").getId());
        assertEquals(2, mModel.getDeclarations(a).size());
        assertEquals("first", mModel.getDeclaration(first).getPayload());
    }

    public void test_ownDeclarationWins() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        mModel.declare(a, "price", FeatureKind.PROPERTY, 2, "deep");
        NodeId b = mModel.createNode(a, "B");
        NodeId c = mModel.createNode(b, "C");
        mModel.declare(c, "price", FeatureKind.PROPERTY, 0, "own");

        assertEquals("own", mModel.resolve(c, "price").getPayload());
    }

    public void test_rootDeepDeclaration() throws Exception {
        mModel.declare(mRoot, "meta", FeatureKind.PROPERTY, 2, "m");
        NodeId a = mModel.createNode(mRoot, "A");
        NodeId b = mModel.createNode(a, "B");

        assertNull(mModel.tryResolve(mRoot, "meta"));
        assertNull(mModel.tryResolve(a, "meta"));
        assertEquals("m", mModel.resolve(b, "meta").getPayload());
    }

    public void test_declarationLookup() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        DeclarationId id = mModel.declare(a, "price", FeatureKind.PROPERTY, 2, "p");

        Declaration decl = mModel.getDeclaration(id);
        assertNotNull(decl);
        assertEquals(id, decl.getId());
        assertEquals("price", decl.getName());
        assertEquals(FeatureKind.PROPERTY, decl.getKind());
        assertEquals(a, decl.getOwner());
        assertEquals(mModel.getDeclarations(mModel.getCarrier(a, 2)).get(0), decl);

        assertNull(mModel.getDeclaration(new DeclarationId(424242)));
    }

    public void test_nodeNames() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        NodeId anonymous = mModel.createNode(a, null);

        assertEquals("A", mModel.getNodeName(a));
        assertNull(mModel.getNodeName(anonymous));
        assertFalse(mModel.isCarrier(a));
        assertEquals(Arrays.asList(a), mModel.getInstances(mRoot));
    }

    public void test_nullArguments() throws Exception {
        NodeId a = mModel.createNode(mRoot, "A");
        try {
            mModel.createNode(null, "X");
            fail();
        } catch (IllegalArgumentException e) {
        }
        try {
            mModel.declare(a, null, FeatureKind.PROPERTY, 1, null);
            fail();
        } catch (IllegalArgumentException e) {
        }
        try {
            mModel.declare(a, "x", null, 1, null);
            fail();
        } catch (IllegalArgumentException e) {
        }
        try {
            mModel.tryResolve(a, null);
            fail();
        } catch (IllegalArgumentException e) {
        }
    }
}
