/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.cppflow;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import javax.annotation.Nonnull;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line front end: prints the variants, the min-cover define sets,
 * the tested macros or the flow graph of one source file.
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public static void main(String[] args) throws Exception {
        int status = new Main().run(args, System.out, System.err);
        if (status != EXIT_OK)
            System.exit(status);
    }

    public int run(@Nonnull String[] args, @Nonnull PrintStream out, @Nonnull PrintStream err)
            throws IOException {
        OptionParser parser = new OptionParser();
        OptionSpec<?> helpOption = parser.accepts("help",
                "Displays command-line help.")
                .forHelp();
        OptionSpec<?> debugOption = parser.acceptsAll(Arrays.asList("debug"),
                "Enables debug output.");
        OptionSpec<Integer> limitOption = parser.accepts("limit-variants",
                "Stops after the given number of variants (0 for no limit).")
                .withRequiredArg().ofType(Integer.class).describedAs("number").defaultsTo(20);
        OptionSpec<Integer> maxMacrosOption = parser.accepts("max-macros",
                "Maximum number of distinct macros tested by conditionals.")
                .withRequiredArg().ofType(Integer.class).describedAs("number")
                .defaultsTo(MacroRegistry.DEFAULT_CAPACITY);
        OptionSpec<?> minCoverOption = parser.accepts("min-cover",
                "Prints define sets which together cover every token, instead of every variant.");
        OptionSpec<?> listMacrosOption = parser.accepts("list-macros",
                "Prints the macros tested by conditionals.");
        OptionSpec<?> dotOption = parser.accepts("dot",
                "Prints the flow graph in Graphviz DOT form.");
        OptionSpec<?> jsonOption = parser.accepts("json",
                "Prints results as JSON.");
        OptionSpec<File> inputsOption = parser.nonOptions()
                .ofType(File.class).describedAs("File to analyze.");

        OptionSet options;
        try {
            options = parser.parse(args);
        } catch (OptionException e) {
            err.println(e.getMessage());
            parser.printHelpOn(err);
            return EXIT_USAGE;
        }

        if (options.has(helpOption)) {
            parser.printHelpOn(out);
            return EXIT_OK;
        }

        List<File> inputs = options.valuesOf(inputsOption);
        if (inputs.size() != 1) {
            err.println("Exactly one input file is required.");
            parser.printHelpOn(err);
            return EXIT_USAGE;
        }
        int limit = options.valueOf(limitOption);
        int maxMacros = options.valueOf(maxMacrosOption);
        if (limit < 0 || maxMacros <= 0) {
            err.println("--limit-variants must not be negative and --max-macros must be positive.");
            return EXIT_USAGE;
        }

        File input = inputs.get(0);
        try {
            FlowAnalyzer analyzer = new FlowAnalyzer(new FileLexerSource(input));
            if (options.has(debugOption))
                analyzer.addFeature(Feature.DEBUG);
            analyzer.setMacroCapacity(maxMacros);
            boolean json = options.has(jsonOption);

            if (options.has(listMacrosOption)) {
                listMacros(analyzer, json, out);
            } else if (options.has(dotOption)) {
                out.print(analyzer.getFlowGraph().toDot());
            } else if (options.has(minCoverOption)) {
                minCover(analyzer, json, out);
            } else {
                variants(analyzer, limit, json, out);
            }
            return EXIT_OK;
        } catch (IOException e) {
            LOG.error("Reading " + input + " failed", e);
            err.println(input + ": " + e.getMessage());
            return EXIT_FAILED;
        } catch (LexerException e) {
            LOG.error("Lexing " + input + " failed", e);
            err.println(input + ": " + e.getMessage());
            return EXIT_FAILED;
        } catch (FlowException e) {
            LOG.error("Analysis of " + input + " failed: " + e.getKind());
            err.println(input + ": " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    private void listMacros(@Nonnull FlowAnalyzer analyzer, boolean json, @Nonnull PrintStream out)
            throws FlowException {
        List<Macro> macros = analyzer.getUsedMacros();
        if (json) {
            JsonArray array = new JsonArray();
            for (Macro m : macros) {
                JsonObject object = new JsonObject();
                object.addProperty("name", m.getName());
                object.addProperty("id", m.getId());
                array.add(object);
            }
            out.println(gson.toJson(array));
            return;
        }
        for (Macro m : macros)
            out.println(m.getId() + " " + m.getName());
    }

    private void minCover(@Nonnull FlowAnalyzer analyzer, boolean json, @Nonnull PrintStream out)
            throws FlowException {
        MinCoverResult result = analyzer.minCoverVariants();
        if (json) {
            JsonObject object = new JsonObject();
            JsonArray sets = new JsonArray();
            for (DefineSet defines : result.getDefineSets()) {
                JsonArray names = new JsonArray();
                for (String name : defines.getNames())
                    names.add(new JsonPrimitive(name));
                sets.add(names);
            }
            object.add("defineSets", sets);
            object.addProperty("complete", result.isComplete());
            if (!result.isComplete())
                object.addProperty("uncovered", result.getUncovered().toString());
            out.println(gson.toJson(object));
            return;
        }
        int counter = 0;
        for (DefineSet defines : result.getDefineSets()) {
            counter++;
            StringBuilder buf = new StringBuilder("Define set ").append(counter).append(':');
            for (String name : defines.getNames())
                buf.append(' ').append(name);
            out.println(buf);
        }
        if (!result.isComplete())
            out.println("Incomplete cover, unreached positions " + result.getUncovered());
        LOG.info("Min-cover of " + result.getTokenCount() + " tokens: " + counter + " define sets");
    }

    private void variants(@Nonnull FlowAnalyzer analyzer, final int limit, final boolean json, @Nonnull final PrintStream out)
            throws FlowException {
        final List<Macro> macros = analyzer.getUsedMacros();
        final JsonArray array = new JsonArray();
        final int[] counter = new int[1];

        analyzer.generateVariants(new VariantReceiver() {
            @Override
            public boolean receive(Variant variant) {
                counter[0]++;
                if (json) {
                    array.add(toJson(variant, macros));
                } else {
                    out.println("Variant number " + counter[0] + ":");
                    for (Token tok : variant.getTokens())
                        out.println(tok.getText());
                }
                if (limit > 0 && counter[0] >= limit) {
                    LOG.warn("Stopped after " + limit + " variants");
                    return false;
                }
                return true;
            }
        });

        if (json) {
            JsonObject object = new JsonObject();
            JsonArray names = new JsonArray();
            for (Macro m : macros)
                names.add(new JsonPrimitive(m.getName()));
            object.add("macros", names);
            object.add("variants", array);
            out.println(gson.toJson(object));
        }
        LOG.info("Printed " + counter[0] + " variants");
    }

    @Nonnull
    private static JsonObject toJson(@Nonnull Variant variant, @Nonnull List<Macro> macros) {
        JsonObject result = new JsonObject();
        JsonArray tokens = new JsonArray();
        for (Token tok : variant.getTokens())
            tokens.add(new JsonPrimitive(tok.getText()));
        result.add("tokens", tokens);
        JsonArray defined = new JsonArray();
        JsonArray undefined = new JsonArray();
        for (Macro m : macros) {
            if (!variant.isResolved(m.getId()))
                continue;
            if (variant.isAssumed(m.getId()))
                defined.add(new JsonPrimitive(m.getName()));
            else
                undefined.add(new JsonPrimitive(m.getName()));
        }
        result.add("defined", defined);
        result.add("undefined", undefined);
        return result;
    }
}
