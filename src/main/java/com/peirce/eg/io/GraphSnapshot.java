package com.peirce.eg.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.peirce.eg.api.HookRef;
import com.peirce.eg.model.Context;
import com.peirce.eg.model.GraphModel;
import com.peirce.eg.model.Ligature;
import com.peirce.eg.model.Predicate;

import lombok.Data;

/**
 * POJO read-back of a graph's state for display clients.
 *
 * <p>
 * A snapshot is a copy: it does not track later edits and cannot be loaded
 * back into a model.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphSnapshot {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private int sheet;
    private List<ContextDef> contexts = new ArrayList<>();
    private List<PredicateDef> predicates = new ArrayList<>();
    private List<LigatureDef> ligatures = new ArrayList<>();

    /** One context with its depth and ordered children. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class ContextDef {
        private int id;
        private Integer parent;
        private int depth;
        private List<Integer> children;
    }

    /** One predicate; {@code hooks[i]} is the ligature on hook i+1, or null. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PredicateDef {
        private int id, parent, arity;
        private String label, kind;
        private List<Integer> hooks;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class LigatureDef {
        private int id;
        private List<String> attachments;
        private List<Integer> traversedCuts;
    }

    public static GraphSnapshot of(GraphModel model) {
        GraphSnapshot snap = new GraphSnapshot();
        snap.setSheet(model.sheetOfAssertion());
        for (Context c : model.contexts()) {
            ContextDef cd = new ContextDef();
            cd.setId(c.id());
            int parent = model.parentOf(c.id());
            cd.setParent(parent == -1 ? null : parent);
            int depth = 0;
            for (int a = parent; a != -1; a = model.parentOf(a))
                depth++;
            cd.setDepth(depth);
            cd.setChildren(new ArrayList<>(c.children()));
            snap.getContexts().add(cd);
        }
        for (Predicate p : model.predicates()) {
            PredicateDef pd = new PredicateDef();
            pd.setId(p.id());
            pd.setParent(model.parentOf(p.id()));
            pd.setLabel(p.label());
            pd.setArity(p.arity());
            pd.setKind(p.kind().name());
            List<Integer> hooks = new ArrayList<>(p.arity());
            for (int i = 1; i <= p.arity(); i++)
                hooks.add(p.isBound(i) ? p.ligatureAt(i) : null);
            pd.setHooks(hooks);
            snap.getPredicates().add(pd);
        }
        for (Ligature l : model.ligatures()) {
            LigatureDef ld = new LigatureDef();
            ld.setId(l.id());
            List<String> attachments = new ArrayList<>();
            for (HookRef h : l.attachments())
                attachments.add(h.toString());
            ld.setAttachments(attachments);
            ld.setTraversedCuts(new ArrayList<>(l.traversedCuts()));
            snap.getLigatures().add(ld);
        }
        return snap;
    }

    public String toJson() {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static GraphSnapshot fromJson(String json) {
        try {
            return MAPPER.readValue(json, GraphSnapshot.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid snapshot JSON: " + e.getMessage(), e);
        }
    }
}
