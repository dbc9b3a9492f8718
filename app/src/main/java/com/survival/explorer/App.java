package com.survival.explorer;

import com.survival.explorer.core.DecisionPath;
import com.survival.explorer.core.ExplorerConfig;
import com.survival.explorer.core.FeatureVector;
import com.survival.explorer.core.MissingFeatureException;
import com.survival.explorer.core.TreeModel;
import com.survival.explorer.highlight.Cohort;
import com.survival.explorer.highlight.HighlightRequest;
import com.survival.explorer.hover.HighlightView;
import com.survival.explorer.io.TreeModelReader;
import com.survival.explorer.render.TreeStyleResolver;
import com.survival.explorer.report.HighlightJsonConverter;
import com.survival.explorer.report.PathReporter;
import com.survival.explorer.trace.HighlightMode;
import com.survival.explorer.trace.RevealSchedule;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class App {

    public static void main(String[] args) {
        System.out.println("=== Survival Path Explorer ===");

        List<String> positional = new ArrayList<>();
        String modeArg = null;
        String outArg = null;
        boolean reveal = false;
        for (String arg : args) {
            if (arg.startsWith("--mode=")) {
                modeArg = arg.substring("--mode=".length());
            } else if (arg.startsWith("--out=")) {
                outArg = arg.substring("--out=".length());
            } else if (arg.equals("--reveal")) {
                reveal = true;
            } else {
                positional.add(arg);
            }
        }

        if (positional.size() < 2) {
            System.err.println("Usage: app <tree.json> <cohortA> [cohortB] [--mode=full|first_split|<depth>] "
                    + "[--out=<file.json>] [--reveal]");
            System.err.println("  cohort format: sex=0,pclass=1,age=30,fare=84");
            System.exit(1);
        }

        try {
            ExplorerConfig config = ExplorerConfig.load(Path.of("."));

            System.out.println("\n>>> LOADING TREE <<<");
            TreeModel tree = new TreeModelReader().read(Path.of(positional.get(0)));
            System.out.printf("Loaded %d nodes, max depth %d%n", tree.size(), tree.maxDepth());

            FeatureVector first = FeatureVector.parse(positional.get(1));
            TreeHighlightSession session = new TreeHighlightSession(tree);
            PathReporter reporter = new PathReporter();

            if (positional.size() >= 3) {
                FeatureVector second = FeatureVector.parse(positional.get(2));
                System.out.println("\n>>> COMPARING COHORTS <<<");
                session.update(HighlightRequest.dual(Cohort.of("Cohort A", first), Cohort.of("Cohort B", second)));
                session.current().resolution().ifPresent(resolution ->
                        System.out.print(reporter.formatComparison(tree, resolution, "Cohort A", "Cohort B")));
            } else {
                HighlightMode mode = modeArg == null ? config.getDefaultHighlightMode() : HighlightMode.parse(modeArg);
                System.out.println("\n>>> TRACING PATH (" + mode + ") <<<");
                session.update(HighlightRequest.single(first, mode));
                Optional<DecisionPath> traced = session.current().tracedPath();
                if (traced.isPresent()) {
                    DecisionPath path = traced.get();
                    System.out.print(reporter.formatPath(tree, path));
                    if (reveal) {
                        System.out.println("\n--- Reveal schedule ---");
                        for (RevealSchedule.RevealStep step : RevealSchedule.forPath(path, config.getRevealStepMillis())) {
                            System.out.printf("  %-12s hold %d ms%n",
                                    step.isHidden() ? "(hidden)" : step.mode(), step.durationMillis());
                        }
                    }
                }
            }

            if (session.current().isIdle()) {
                System.out.println("Nothing highlighted (missing feature values?)");
            }

            if (outArg != null) {
                HighlightView view = session.view();
                TreeStyleResolver styles = new TreeStyleResolver(config);
                HighlightJsonConverter converter = new HighlightJsonConverter();
                String json = String.format("{\"highlight\":%s,\"style\":%s}",
                        converter.convertToViewJson(tree, view),
                        converter.convertToStyleJson(styles.nodeStyles(tree, view), styles.edgeStyles(tree, view)));
                Path out = Path.of(outArg);
                Files.writeString(out, json);
                System.out.println("\nHighlight JSON written to: " + out.toAbsolutePath());
            }

        } catch (MissingFeatureException | IllegalArgumentException | IllegalStateException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(2);
        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
