/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.strata.registry;

/**
 * Base for registries with an explicit {@code init -> register* -> freeze -> use} lifecycle.
 * Subclasses call {@link #checkNotFrozen()} from their registration methods and
 * {@link #checkFrozen()} from their lookup methods.
 */
public abstract class FreezableRegistry {
    private volatile boolean frozen = false;

    public final synchronized void freeze() {
        if (!frozen) {
            onFreeze();
            frozen = true;
        }
    }

    public final boolean isFrozen() {
        return frozen;
    }

    /**
     * Hook invoked once, right before the registry becomes read-only.
     */
    protected void onFreeze() {
    }

    protected final void checkNotFrozen() {
        if (frozen) {
            throw new IllegalStateException(getClass().getSimpleName() + " is frozen, no more registrations are allowed");
        }
    }

    protected final void checkFrozen() {
        if (!frozen) {
            throw new IllegalStateException(getClass().getSimpleName() + " must be frozen before it can be used");
        }
    }
}
