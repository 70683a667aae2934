package com.gamebook.pipeline;

import com.gamebook.AppLogger;
import com.gamebook.PipelineConfigStore.PipelineConfig;
import com.gamebook.ingest.ChoiceExtractor;
import com.gamebook.ingest.NodeClassifier;
import com.gamebook.ingest.PageTextSource;
import com.gamebook.ingest.ProseCleaner;
import com.gamebook.ingest.TextNormalizer;
import com.gamebook.ingest.TitleInferrer;
import com.gamebook.models.ExtractedChoice;
import com.gamebook.models.StoryChoice;
import com.gamebook.models.StoryNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Expands a FIFO frontier of section numbers into a node set, pulling pages referenced by
 * extracted choices. Destinations may still dangle afterwards; {@link GraphRepairer} closes them.
 */
public class GraphAssembler {

    private static final String TERMINAL_MARKER = "the end";

    private final PipelineConfig config;
    private final TextNormalizer normalizer;
    private final ChoiceExtractor extractor;
    private final ProseCleaner cleaner;
    private final NodeClassifier classifier;
    private final TitleInferrer titleInferrer;
    private final AppLogger logger = AppLogger.get();

    public GraphAssembler(PipelineConfig config) {
        this(config, new TextNormalizer());
    }

    private GraphAssembler(PipelineConfig config, TextNormalizer normalizer) {
        this(config, normalizer, new ChoiceExtractor(normalizer), new NodeClassifier(), new TitleInferrer());
    }

    public GraphAssembler(PipelineConfig config, TextNormalizer normalizer, ChoiceExtractor extractor,
                          NodeClassifier classifier, TitleInferrer titleInferrer) {
        this.config = config != null ? config : new PipelineConfig();
        this.normalizer = normalizer;
        this.extractor = extractor;
        this.cleaner = new ProseCleaner(extractor);
        this.classifier = classifier;
        this.titleInferrer = titleInferrer;
    }

    /**
     * Assemble every section reachable from the prior graph's sections and the entry section.
     *
     * @param source page text by section number
     * @param prior graph from an earlier run, may be empty
     */
    public StoryGraph assemble(PageTextSource source, StoryGraph prior) {
        StoryGraph previous = prior != null ? prior : StoryGraph.empty();
        int entrySection = config.getEntrySection();
        int maxNodes = config.getMaxNodes();

        TreeSet<Integer> seeds = new TreeSet<>(previous.sectionNumbers());
        if (source.looksUsable(entrySection)) {
            seeds.add(entrySection);
        }

        Deque<Integer> queue = new ArrayDeque<>(seeds);
        Set<Integer> queued = new HashSet<>(seeds);
        TreeMap<Integer, StoryNode> assembled = new TreeMap<>();

        while (!queue.isEmpty()) {
            if (assembled.size() >= maxNodes) {
                logWarn("Safety cap of " + maxNodes + " nodes reached, " + queue.size() + " sections left unassembled");
                break;
            }
            int sectionNumber = queue.poll();
            if (assembled.containsKey(sectionNumber)) {
                continue;
            }
            StoryNode node = assembleSection(source, sectionNumber, previous.get(sectionNumber));
            assembled.put(sectionNumber, node);

            for (StoryChoice choice : node.getChoices()) {
                Integer destination = choice.getDestination();
                if (destination == null || assembled.containsKey(destination) || queued.contains(destination)) {
                    continue;
                }
                if (previous.contains(destination) || source.looksUsable(destination)) {
                    queue.add(destination);
                    queued.add(destination);
                }
            }
        }

        addMissingDestinations(source, previous, assembled, maxNodes);
        log("Assembled " + assembled.size() + " sections");
        return StoryGraph.of(assembled.values(), entrySection);
    }

    // Destinations rejected during the main loop can still have a usable page.
    private void addMissingDestinations(PageTextSource source, StoryGraph previous,
                                        TreeMap<Integer, StoryNode> assembled, int maxNodes) {
        while (true) {
            TreeSet<Integer> missing = new TreeSet<>();
            for (StoryNode node : assembled.values()) {
                for (StoryChoice choice : node.getChoices()) {
                    Integer destination = choice.getDestination();
                    if (destination != null && !assembled.containsKey(destination)) {
                        missing.add(destination);
                    }
                }
            }
            if (missing.isEmpty()) {
                return;
            }

            boolean addedAny = false;
            for (int destination : missing) {
                if (assembled.size() >= maxNodes) {
                    logWarn("Safety cap of " + maxNodes + " nodes reached while adding missing destinations");
                    return;
                }
                if (source.looksUsable(destination)) {
                    assembled.put(destination, assembleSection(source, destination, previous.get(destination)));
                    log("Added missing destination section " + destination + " from page source");
                    addedAny = true;
                }
            }
            if (!addedAny) {
                return;
            }
        }
    }

    /**
     * Build one node from its page, absorbing continuation pages while no choice has been found.
     */
    public StoryNode assembleSection(PageTextSource source, int sectionNumber, StoryNode priorNode) {
        String combined = normalizer.normalize(source.textFor(sectionNumber));
        List<ExtractedChoice> choices = extractor.extract(combined);

        int absorbed = 0;
        if (!combined.isBlank()) {
            for (int step = 1; step <= config.getContinuationPages(); step++) {
                if (!choices.isEmpty() || combined.toLowerCase(Locale.ROOT).contains(TERMINAL_MARKER)) {
                    break;
                }
                String continuation = source.textFor(sectionNumber + step);
                if (continuation == null || continuation.isBlank() || source.looksLikeNewSection(continuation)) {
                    break;
                }
                combined = combined + "\n" + normalizer.normalize(continuation);
                absorbed++;
                List<ExtractedChoice> updated = extractor.extract(combined);
                if (!updated.isEmpty()) {
                    choices = updated;
                }
            }
        }

        String priorText = priorNode != null ? priorNode.getText() : null;
        String text = cleaner.clean(combined, sectionNumber, priorText);

        if (choices.isEmpty() && !text.toLowerCase(Locale.ROOT).contains(TERMINAL_MARKER)) {
            choices = priorDestinations(priorNode);
        }

        StoryNode node = new StoryNode(sectionNumber, titleInferrer.inferTitle(sectionNumber, text), text,
            classifier.classify(text, !choices.isEmpty()));
        List<StoryChoice> rows = new ArrayList<>();
        for (ExtractedChoice extracted : choices) {
            if (rows.size() >= StoryNode.MAX_CHOICES) {
                break;
            }
            StoryChoice choice = new StoryChoice(extracted.label(), StoryNode.sectionId(extracted.destination()));
            StoryChoice priorChoice = findPriorChoice(priorNode, choice.getNext());
            if (priorChoice != null) {
                choice.setRequires(priorChoice.getRequires());
                choice.setEffects(priorChoice.getEffects());
            }
            rows.add(choice);
        }
        node.setChoices(rows);
        if (priorNode != null) {
            node.setEffects(priorNode.getEffects());
            node.setRandomEventPool(priorNode.getRandomEventPool());
        }

        log("Assembled section " + sectionNumber + " (" + rows.size() + " choices, "
            + absorbed + " continuation pages)");
        return node;
    }

    private List<ExtractedChoice> priorDestinations(StoryNode priorNode) {
        List<ExtractedChoice> fallback = new ArrayList<>();
        if (priorNode == null) {
            return fallback;
        }
        Set<Integer> seen = new HashSet<>();
        for (StoryChoice choice : priorNode.getChoices()) {
            Integer destination = choice.getDestination();
            if (destination == null || !seen.add(destination)) {
                continue;
            }
            fallback.add(new ExtractedChoice(ChoiceExtractor.defaultLabel(destination), destination));
            if (fallback.size() >= StoryNode.MAX_CHOICES) {
                break;
            }
        }
        return fallback;
    }

    private StoryChoice findPriorChoice(StoryNode priorNode, String next) {
        if (priorNode == null) {
            return null;
        }
        for (StoryChoice choice : priorNode.getChoices()) {
            if (next.equals(choice.getNext())) {
                return choice;
            }
        }
        return null;
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[GraphAssembler] " + message);
        }
    }

    private void logWarn(String message) {
        if (logger != null) {
            logger.warn("[GraphAssembler] " + message);
        }
    }
}
