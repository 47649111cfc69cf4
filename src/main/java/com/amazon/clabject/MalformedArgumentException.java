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

import java.util.Collections;
import java.util.List;

/**
 * A MalformedArgumentException is thrown when an argument passed to a {@link
 * Model} operation is well formed Java but meaningless to the model. This
 * class is abstract to prevent its direct use. Subclasses describe the
 * specific problem.
 *
 * @author Brian S O'Neill
 */
public abstract class MalformedArgumentException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private List<String> mMessages;

    protected MalformedArgumentException(String message) {
        super(message);
    }

    /**
     * Returns the problem description as a list, for callers which collect
     * messages from several failures.
     *
     * @return non-null, unmodifiable list of messages
     */
    public List<String> getMessages() {
        if (mMessages == null) {
            mMessages = Collections.singletonList(getMessage());
        }
        return mMessages;
    }
}
