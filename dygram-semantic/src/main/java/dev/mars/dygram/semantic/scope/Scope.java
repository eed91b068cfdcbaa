/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.dygram.semantic.scope;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Alias table computed for one machine. The first registration of an alias wins, so
 * duplicate simple names resolve by declaration order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class Scope {

    private final Map<String, ScopeEntry> entries = new LinkedHashMap<>();

    /**
     * @return false if the alias was already taken
     */
    boolean register(ScopeEntry entry) {
        return entries.putIfAbsent(entry.getAlias(), entry) == null;
    }

    public Optional<ScopeEntry> resolve(String alias) {
        return Optional.ofNullable(entries.get(alias));
    }

    public boolean contains(String alias) {
        return entries.containsKey(alias);
    }

    public Set<String> getAliases() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public Collection<ScopeEntry> getEntries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return "Scope{aliases=" + entries.size() + '}';
    }
}
