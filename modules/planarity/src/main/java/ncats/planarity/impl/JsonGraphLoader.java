package ncats.planarity.impl;

import java.io.*;
import java.util.*;
import java.util.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.JsonNode;

import ncats.planarity.PlanarityConfig;
import ncats.planarity.graph.CorridorGraph;
import ncats.planarity.graph.GraphBuilder;

/**
 * Load a {@link CorridorGraph} from a cities json file (array of
 * settlement objects or bare id strings) and a connections json file
 * (object with an edges array, or just the array, of {from, to, ...}).
 * Only the endpoints of each connection are used.
 */
public class JsonGraphLoader {
    static final Logger logger =
        Logger.getLogger(JsonGraphLoader.class.getName());

    public static final String DEFAULT_ID_FIELD = "id";
    public static final String DEFAULT_EDGES_FIELD = "edges";
    
    final ObjectMapper mapper = new ObjectMapper ();
    final String idField;
    final String edgesField;

    public JsonGraphLoader () {
        this (DEFAULT_ID_FIELD, DEFAULT_EDGES_FIELD);
    }

    public JsonGraphLoader (PlanarityConfig config) {
        this (config.getIdField(), config.getEdgesField());
    }
    
    public JsonGraphLoader (String idField, String edgesField) {
        this.idField = idField;
        this.edgesField = edgesField;
    }

    public CorridorGraph load (File cities, File connections)
        throws IOException {
        try (InputStream cis = new FileInputStream (cities);
             InputStream eis = new FileInputStream (connections)) {
            logger.info("Loading graph from "+cities+" and "+connections);
            return load (cis, eis);
        }
    }

    public CorridorGraph load (InputStream cities, InputStream connections)
        throws IOException {
        List<String> nodes = readNodes (cities);
        List<String[]> edges = readEdges (connections);
        
        GraphBuilder builder = new GraphBuilder (nodes);
        for (String[] e : edges)
            builder.add(e[0], e[1]);
        CorridorGraph graph = builder.build();

        logger.info(nodes.size()+" settlement(s), "+edges.size()
                    +" connection(s) loaded; graph has "
                    +graph.edgeCount()+" edge(s)");
        if (graph.getUnknownEndpoints() > 0)
            logger.warning(graph.getUnknownEndpoints()
                           +" connection(s) reference unknown settlements");
        if (graph.getSelfLoops() > 0 || graph.getDuplicates() > 0)
            logger.fine(graph.getSelfLoops()+" self-loop(s) and "
                        +graph.getDuplicates()+" duplicate(s) ignored");
        
        return graph;
    }

    public List<String> readNodes (InputStream is) throws IOException {
        JsonNode root = mapper.readTree(is);
        if (root == null || !root.isArray())
            throw new IOException ("Cities json is not an array!");

        Set<String> nodes = new LinkedHashSet<>();
        for (int i = 0; i < root.size(); ++i) {
            JsonNode n = root.get(i);
            String id = null;
            if (n.isTextual()) {
                id = n.asText();
            }
            else if (n.hasNonNull(idField)) {
                id = n.get(idField).asText();
            }

            if (id == null || id.isEmpty()) {
                logger.warning("Settlement at position "+i+" has no \""
                               +idField+"\"; skipping!");
            }
            else if (!nodes.add(id)) {
                logger.warning("Settlement \""+id+"\" is repeated at "
                               +"position "+i+"; keeping the first!");
            }
        }
        return new ArrayList<>(nodes);
    }

    public List<String[]> readEdges (InputStream is) throws IOException {
        JsonNode root = mapper.readTree(is);
        JsonNode edges = root;
        if (root != null && root.isObject())
            edges = root.get(edgesField);
        
        List<String[]> pairs = new ArrayList<>();
        if (edges == null || edges.isNull()) {
            logger.warning("Connections json has no \""+edgesField+"\"!");
            return pairs;
        }
        
        if (!edges.isArray())
            throw new IOException
                ("Connections \""+edgesField+"\" is not an array!");

        for (int i = 0; i < edges.size(); ++i) {
            JsonNode e = edges.get(i);
            if (!e.hasNonNull("from") || !e.hasNonNull("to")) {
                logger.warning("Connection at position "+i
                               +" lacks \"from\" or \"to\"; skipping!");
                continue;
            }
            pairs.add(new String[]{
                    e.get("from").asText(), e.get("to").asText()
                });
        }
        return pairs;
    }
}
