package com.partsbin.cli;

import com.partsbin.config.ConfigService;
import com.partsbin.core.allocation.AllocationEngine;
import com.partsbin.core.allocation.AllocationPipeline;
import com.partsbin.core.allocation.AllocationTopology;
import com.partsbin.core.catalog.CatalogMergeResult;
import com.partsbin.core.catalog.CatalogMerger;
import com.partsbin.core.catalog.InventoryRecord;
import com.partsbin.core.catalog.ReferenceDatasetLoader;
import com.partsbin.core.catalog.ReferenceRecord;
import com.partsbin.core.issue.StorageIssue;
import com.partsbin.core.label.LabelCell;
import com.partsbin.core.label.LabelSheetBuilder;
import com.partsbin.core.label.LabelSheetWriter;
import com.partsbin.core.location.LocationMap;
import com.partsbin.core.location.LocationMapStore;
import com.partsbin.core.match.FuzzyMatcher;
import com.partsbin.core.model.ComponentIdentity;
import com.partsbin.core.model.ComponentSpec;
import com.partsbin.core.picking.BomReader;
import com.partsbin.core.picking.PickingSheet;
import com.partsbin.core.picking.PickingSheetGenerator;
import com.partsbin.core.picking.PickingSheetPdfWriter;
import com.partsbin.core.picking.PickingSheetTextRenderer;
import com.partsbin.integration.inventory.InventorySource;
import com.partsbin.integration.inventory.JsonInventorySnapshot;
import com.partsbin.integration.inventory.RetryingInventoryClient;
import com.partsbin.logging.AppLogger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Non-interactive entry point.
 *
 * <pre>
 *   allocate                                  merge catalog, place new types, extend the location map
 *   pick &lt;bom.csv&gt; [--out f] [--pdf f] [--title t]   write a picking sheet (stdout when no --out)
 *   labels &lt;out.csv&gt;                         export drawer label text
 * </pre>
 *
 * Exit status 0 when everything was handled, 1 when the run finished but left issues for review,
 * 2 when it could not run at all.
 */
public final class StorageTool {

    static final int EXIT_OK = 0;
    static final int EXIT_REVIEW = 1;
    static final int EXIT_FATAL = 2;

    private static final Logger LOGGER = AppLogger.get();

    private final ConfigService config;
    private final PrintStream out;

    StorageTool(ConfigService config, PrintStream out) {
        this.config = config;
        this.out = out;
    }

    public static void main(String[] args) {
        int status = new StorageTool(ConfigService.getInstance(), System.out).run(args);
        System.exit(status);
    }

    int run(String[] args) {
        if (args == null || args.length == 0) {
            usage();
            return EXIT_FATAL;
        }
        List<String> rest = Arrays.asList(args).subList(1, args.length);
        try {
            return switch (args[0]) {
                case "allocate" -> allocate();
                case "pick" -> pick(rest);
                case "labels" -> labels(rest);
                default -> {
                    LOGGER.severe("Unknown command: " + args[0]);
                    usage();
                    yield EXIT_FATAL;
                }
            };
        } catch (IOException | RuntimeException ex) {
            LOGGER.log(Level.SEVERE, args[0] + " failed: " + ex.getMessage(), ex);
            return EXIT_FATAL;
        }
    }

    private int allocate() throws IOException {
        // fetched before the store is locked so a slow inventory system never holds the lock
        List<InventoryRecord> inventory = fetchInventory();
        List<ReferenceRecord> reference = new ReferenceDatasetLoader().load(config.getReferenceDatasetPath());
        AllocationTopology topology = loadTopology();

        AllocationPipeline pipeline = new AllocationPipeline(catalogMerger(), new AllocationEngine(), store());
        AllocationPipeline.Outcome outcome = pipeline.run(inventory, reference, topology);

        out.printf("Catalog: %d component type(s)%n", outcome.catalog().specs().size());
        out.printf("New placements: %d%n", outcome.allocation().added().size());
        outcome.allocation().added().forEach((identity, slots) ->
            out.printf("  %-30s %s%n", identity.displayName(), slots.get(0).display()));
        out.printf("Location map version: %d%n", outcome.persisted().version());
        return report(outcome.issues());
    }

    private int pick(List<String> args) throws IOException {
        if (args.isEmpty()) {
            LOGGER.severe("pick needs a BOM file");
            usage();
            return EXIT_FATAL;
        }
        Path bomPath = Path.of(args.get(0));
        Optional<Path> textOut = option(args, "--out").map(Path::of);
        Optional<Path> pdfOut = option(args, "--pdf").map(Path::of);
        String title = option(args, "--title").orElse(stripExtension(bomPath.getFileName().toString()));

        BomReader.Result bom = new BomReader().read(bomPath);
        List<InventoryRecord> inventory = fetchInventory();
        List<ReferenceRecord> reference = new ReferenceDatasetLoader().load(config.getReferenceDatasetPath());
        CatalogMergeResult catalog = catalogMerger().merge(inventory, reference);
        LocationMap locations = store().read();

        PickingSheetGenerator generator = new PickingSheetGenerator(new FuzzyMatcher(config.getMatcherSettings()));
        PickingSheet sheet = generator.generate(title, bom.lines(), locations, stockOf(catalog.specs()), catalog.specs());

        PickingSheetTextRenderer renderer = new PickingSheetTextRenderer();
        if (textOut.isPresent()) {
            renderer.write(sheet, textOut.get());
            out.println("Picking sheet written to " + textOut.get());
        } else {
            out.print(renderer.render(sheet));
        }
        if (pdfOut.isPresent()) {
            new PickingSheetPdfWriter().write(sheet, pdfOut.get());
            out.println("Picking sheet PDF written to " + pdfOut.get());
        }

        List<StorageIssue> issues = new ArrayList<>(bom.issues());
        issues.addAll(catalog.issues());
        issues.addAll(sheet.issues());
        int status = report(issues);
        return sheet.needsAttention() ? Math.max(status, EXIT_REVIEW) : status;
    }

    private int labels(List<String> args) throws IOException {
        if (args.isEmpty()) {
            LOGGER.severe("labels needs an output file");
            usage();
            return EXIT_FATAL;
        }
        Path target = Path.of(args.get(0));
        LocationMap locations = store().read();
        List<LabelCell> cells = new LabelSheetBuilder().build(locations);
        new LabelSheetWriter().write(cells, target);
        out.printf("%d label cell(s) written to %s%n", cells.size(), target);
        return EXIT_OK;
    }

    private CatalogMerger catalogMerger() {
        return new CatalogMerger(new FuzzyMatcher(config.getMatcherSettings()));
    }

    private List<InventoryRecord> fetchInventory() throws IOException {
        InventorySource snapshot = new JsonInventorySnapshot(config.getInventorySnapshotPath());
        return new RetryingInventoryClient(snapshot, null, config.getRetryPolicy()).fetchComponents();
    }

    private AllocationTopology loadTopology() throws IOException {
        Optional<Path> path = config.getTopologyPath();
        return path.isPresent() ? AllocationTopology.load(path.get()) : AllocationTopology.loadDefault();
    }

    private LocationMapStore store() {
        return new LocationMapStore(config.getLocationMapPath());
    }

    private int report(List<StorageIssue> issues) {
        if (issues.isEmpty()) {
            return EXIT_OK;
        }
        out.printf("%d issue(s):%n", issues.size());
        boolean review = false;
        for (StorageIssue issue : issues) {
            out.println("  " + issue);
            review |= issue.type().requiresReview();
        }
        return review ? EXIT_REVIEW : EXIT_OK;
    }

    static Map<ComponentIdentity, Integer> stockOf(Collection<ComponentSpec> specs) {
        Map<ComponentIdentity, Integer> stock = new TreeMap<>();
        for (ComponentSpec spec : specs) {
            if (spec.quantityOnHand() > 0) {
                stock.put(spec.identity(), spec.quantityOnHand());
            }
        }
        return stock;
    }

    static Optional<String> option(List<String> args, String name) {
        int index = args.indexOf(name);
        if (index < 0) {
            return Optional.empty();
        }
        if (index + 1 >= args.size()) {
            throw new IllegalArgumentException(name + " needs a value");
        }
        return Optional.of(args.get(index + 1));
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private void usage() {
        out.println("usage: StorageTool allocate");
        out.println("       StorageTool pick <bom.csv> [--out <sheet.txt>] [--pdf <sheet.pdf>] [--title <title>]");
        out.println("       StorageTool labels <labels.csv>");
    }
}
