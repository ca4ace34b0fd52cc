package com.nomadtap.tap.service;

import com.nomadtap.tap.model.CatalogEntry;
import com.nomadtap.tap.model.StreamDefinition;
import com.nomadtap.tap.model.StreamSelection;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Narrows the discovered catalog to the streams a user selected.
 *
 * Output order is always discovery order, whatever order the user catalog lists streams in,
 * so consecutive runs execute streams in the same sequence.
 */
@Component
public class CatalogFilter {

    /**
     * @param fullCatalog discovered definitions, in discovery order
     * @param userCatalog selections keyed by stream name; streams absent from it are not selected
     */
    public List<CatalogEntry> select(List<StreamDefinition> fullCatalog, Map<String, StreamSelection> userCatalog) {
        List<CatalogEntry> selected = new ArrayList<>();
        for (StreamDefinition definition : fullCatalog) {
            StreamSelection selection = userCatalog.get(definition.name());
            if (selection != null && selection.selected()) {
                selected.add(new CatalogEntry(definition, true, selection.fieldSelection()));
            }
        }
        return selected;
    }

    /** Every discovered stream, selected with all fields. Used when no user catalog is given. */
    public List<CatalogEntry> selectAll(List<StreamDefinition> fullCatalog) {
        return fullCatalog.stream().map(CatalogEntry::discovered).toList();
    }

    /** Streams the user selected that discovery does not know about. */
    public List<String> unknownSelections(List<StreamDefinition> fullCatalog, Map<String, StreamSelection> userCatalog) {
        Set<String> known = fullCatalog.stream().map(StreamDefinition::name).collect(Collectors.toSet());
        return userCatalog.entrySet().stream()
                .filter(e -> e.getValue().selected() && !known.contains(e.getKey()))
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }
}
