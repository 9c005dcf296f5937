package com.peirce.eg;

import com.peirce.eg.api.EditListener;
import com.peirce.eg.api.EgSettings;
import com.peirce.eg.engine.EgEditor;
import com.peirce.eg.engine.EgValidator;
import com.peirce.eg.io.ClifParser;
import com.peirce.eg.io.ClifTranslator;
import com.peirce.eg.io.GraphSnapshot;
import com.peirce.eg.model.GraphModel;
import com.peirce.eg.util.CompositeEditListener;
import com.peirce.eg.util.EgExplain;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A graph together with its editor and CLIF translation.
 * <p>
 * This class handles:
 * <ul>
 * <li>Building a graph from CLIF text via {@link ClifParser}</li>
 * <li>Exposing the {@link EgEditor} and {@link EgValidator} for edits</li>
 * <li>Rendering the current state as canonical CLIF</li>
 * <li>Diagnostics and JSON read-back</li>
 * </ul>
 */
public class ExistentialGraph {
    private static final Logger log = LogManager.getLogger(ExistentialGraph.class);

    private final EgSettings settings;
    private final EgEditor editor;
    private final ClifTranslator translator;
    private final CompositeEditListener compositeListener = new CompositeEditListener();

    /** An empty graph with settings from the classpath. */
    public ExistentialGraph() {
        this(new GraphModel(), EgSettings.defaults());
    }

    public ExistentialGraph(GraphModel model, EgSettings settings) {
        this.settings = settings;
        this.editor = new EgEditor(model, settings);
        this.translator = new ClifTranslator(settings);
        this.editor.setListener(compositeListener);
    }

    /**
     * Builds a graph from one CLIF sentence.
     *
     * @throws com.peirce.eg.api.ClifSyntaxException if the text is not valid CLIF.
     */
    public static ExistentialGraph fromClif(String clif) {
        return fromClif(clif, EgSettings.defaults());
    }

    public static ExistentialGraph fromClif(String clif, EgSettings settings) {
        GraphModel model = new ClifParser(settings).parse(clif);
        log.info("Loaded graph with {} predicates from CLIF", model.predicateCount());
        return new ExistentialGraph(model, settings);
    }

    /** Canonical CLIF for the current state. */
    public String toClif() {
        return translator.translate(editor.model());
    }

    /**
     * Registers a listener for successful edits. Adds to the existing
     * listeners rather than replacing them.
     */
    public void addListener(EditListener listener) {
        compositeListener.addForComposite(listener);
    }

    public EgEditor editor() {
        return editor;
    }

    public EgValidator validator() {
        return editor.validator();
    }

    public GraphModel model() {
        return editor.model();
    }

    public EgSettings settings() {
        return settings;
    }

    public String explain() {
        return new EgExplain(editor).explainTree();
    }

    public String explain(int elementId) {
        return new EgExplain(editor).explainElement(elementId);
    }

    public GraphSnapshot snapshot() {
        return GraphSnapshot.of(editor.model());
    }

    public String toJson() {
        return snapshot().toJson();
    }

    @Override
    public String toString() {
        return toClif();
    }
}
