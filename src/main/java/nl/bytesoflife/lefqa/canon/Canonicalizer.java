package nl.bytesoflife.lefqa.canon;

import nl.bytesoflife.lefqa.RunContext;
import nl.bytesoflife.lefqa.model.LayerCollection;
import nl.bytesoflife.lefqa.model.LefCell;
import nl.bytesoflife.lefqa.model.LefLayer;
import nl.bytesoflife.lefqa.model.LefLibrary;
import nl.bytesoflife.lefqa.model.LefPin;

import java.util.Comparator;

/**
 * Puts a parsed library into canonical order, in place.
 * <p>
 * Cells and pins sort by name. Simple properties follow the cell and pin priority tables,
 * PROPERTY lines sort lexically, layers follow the active layer order and geometry
 * statements sort by {@link CoordinateComparator}. Ports are ordered with
 * {@link GeometryComparators#COLLECTIONS} after their own contents are sorted.
 */
public class Canonicalizer {

    private final Comparator<String> layerOrder;

    public Canonicalizer(RunContext context) {
        this.layerOrder = PropertyOrder.layerNames(context.getLayerOrder());
    }

    public LefLibrary canonicalize(LefLibrary library) {
        library.sortCellsByName();
        for (LefCell cell : library.getCells()) {
            canonicalize(cell);
        }
        return library;
    }

    void canonicalize(LefCell cell) {
        cell.sortProperties(PropertyOrder.cellProperties());
        cell.sortKeywordProperties();
        cell.getPins().sort(Comparator.comparing(LefPin::getName));
        for (LefPin pin : cell.getPins()) {
            canonicalize(pin);
        }
        if (cell.getObstruction() != null) {
            canonicalize(cell.getObstruction());
        }
    }

    void canonicalize(LefPin pin) {
        pin.sortProperties(PropertyOrder.pinProperties());
        pin.sortKeywordProperties();
        for (LayerCollection port : pin.getPorts()) {
            canonicalize(port);
        }
        pin.sortPorts(GeometryComparators.COLLECTIONS);
    }

    void canonicalize(LayerCollection collection) {
        collection.reorderLayers(layerOrder);
        for (LefLayer layer : collection.getLayers()) {
            layer.sortCoordinates(CoordinateComparator.INSTANCE);
        }
    }
}
