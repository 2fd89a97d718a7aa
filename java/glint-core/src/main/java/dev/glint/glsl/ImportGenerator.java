/**
 * (c) Copyright 2025 SpiralDB Inc. All rights reserved.
 * <p>
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * <p>
 * http://www.apache.org/licenses/LICENSE-2.0
 * <p>
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.glint.glsl;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import dev.glint.api.BindingResolver;
import dev.glint.api.GlslTranslationException;
import dev.glint.api.Node;
import dev.glint.api.forms.Call;
import dev.glint.api.forms.Symbol;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lifts the forms named by {@code (import (namespace symbol...) ...)} into the program.
 * <p>
 * Starting from the expanded root form, every round scans the forms added by the previous round
 * for imports, resolves them through the {@link BindingResolver}, macro expands the results and
 * adds the ones not already in the program. Imported forms may import further forms. A form that
 * is lifted again, including one that imports itself, is only recorded as a dependency, so
 * generation terminates and no form is emitted twice.
 * <p>
 * The program is emitted in dependency order: every lifted form comes ahead of each form that
 * imports it, and the root comes last.
 */
public final class ImportGenerator {
    private static final Logger log = LoggerFactory.getLogger(ImportGenerator.class);

    private final BindingResolver bindings;
    private final int maxRounds;

    public ImportGenerator(BindingResolver bindings, int maxRounds) {
        Preconditions.checkArgument(maxRounds > 0, "maxRounds must be positive: %s", maxRounds);
        this.bindings = Preconditions.checkNotNull(bindings, "bindings");
        this.maxRounds = maxRounds;
    }

    /**
     * Generate the full program for {@code root}.
     *
     * @return the program's top level forms in emission order, generated forms ahead of the
     * forms that import them
     */
    public List<Node> generate(Node root) {
        // form -> the forms its imports lift, in document order
        Map<Node, List<Node>> dependencies = new LinkedHashMap<>();
        Map<Call, List<Node>> resolved = new HashMap<>();

        List<Node> tail = ImmutableList.of(root);
        dependencies.put(root, ImmutableList.of());
        int rounds = 0;
        while (true) {
            Set<Node> generated = new LinkedHashSet<>();
            for (Node form : tail) {
                List<Node> lifted = liftImports(form, resolved);
                dependencies.put(form, lifted);
                for (Node dependency : lifted) {
                    if (!dependencies.containsKey(dependency)) {
                        generated.add(dependency);
                    }
                }
            }
            if (generated.isEmpty()) {
                break;
            }
            rounds++;
            if (rounds > maxRounds) {
                throw GlslTranslationException.of(
                        "import generation did not settle after %s rounds, last generated: %s", maxRounds, generated);
            }
            log.debug("generation round {} lifted {} forms", rounds, generated.size());

            for (Node form : generated) {
                dependencies.put(form, ImmutableList.of());
            }
            tail = ImmutableList.copyOf(generated);
        }

        List<Node> program = new ArrayList<>();
        emitAfterDependencies(root, dependencies, new HashSet<>(), program);
        return ImmutableList.copyOf(program);
    }

    // Post-order, so a form follows everything it imports. A cycle is cut at the form already visited.
    private static void emitAfterDependencies(
            Node form, Map<Node, List<Node>> dependencies, Set<Node> visited, List<Node> program) {
        if (!visited.add(form)) {
            return;
        }
        for (Node dependency : dependencies.get(form)) {
            emitAfterDependencies(dependency, dependencies, visited, program);
        }
        program.add(form);
    }

    private List<Node> liftImports(Node form, Map<Call, List<Node>> resolved) {
        List<Call> imports = new ArrayList<>();
        collectImports(form, imports);

        Set<Node> lifted = new LinkedHashSet<>();
        for (Call importForm : imports) {
            List<Node> forms = resolved.get(importForm);
            if (forms == null) {
                forms = resolve(importForm);
                resolved.put(importForm, forms);
            }
            lifted.addAll(forms);
        }
        return ImmutableList.copyOf(lifted);
    }

    // Pre-order, so imports come out in document order.
    private static void collectImports(Node node, List<Call> imports) {
        if (!(node instanceof Call)) {
            return;
        }
        Call call = (Call) node;
        Optional<Builtin> builtin = Builtin.lookup(call);
        if (builtin.isPresent() && builtin.get() == Builtin.IMPORT) {
            imports.add(call);
            return;
        }
        for (Node element : call.getElements()) {
            collectImports(element, imports);
        }
    }

    private List<Node> resolve(Call importForm) {
        ImmutableList.Builder<Node> resolved = ImmutableList.builder();
        for (Node spec : importForm.getArgs()) {
            if (!(spec instanceof Call) || !(((Call) spec).getHead() instanceof Symbol)) {
                throw GlslTranslationException.of("import expects (namespace symbol...) but got %s", spec);
            }
            Call namespaced = (Call) spec;
            String namespace = ((Symbol) namespaced.getHead()).getName();
            for (Node symbol : namespaced.getArgs()) {
                if (!(symbol instanceof Symbol)) {
                    throw GlslTranslationException.of("cannot import %s from %s, not a symbol", symbol, namespace);
                }
                resolved.add(MacroExpander.expand(bindings.resolve(namespace, ((Symbol) symbol).getName())));
            }
        }
        return resolved.build();
    }
}
