package ncats.planarity;

import java.io.File;
import java.util.logging.Logger;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Settings under the "planarity" path. Defaults live in reference.conf.
 */
public class PlanarityConfig {
    static final Logger logger =
        Logger.getLogger(PlanarityConfig.class.getName());

    public static final String ROOT = "planarity";
    
    final String cities;
    final String connections;
    final String idField;
    final String edgesField;
    final int threads;
    final int largeComponentWarning;

    public PlanarityConfig () {
        this (ConfigFactory.load());
    }

    public PlanarityConfig (Config conf) {
        if (!conf.hasPath(ROOT)) {
            throw new IllegalArgumentException
                ("Configuration contains no \""+ROOT+"\" definition!");
        }
        
        Config pc = conf.getConfig(ROOT);
        cities = pc.getString("cities");
        connections = pc.getString("connections");
        idField = pc.getString("id-field");
        edgesField = pc.getString("edges-field");
        threads = pc.getInt("threads");
        if (threads < 1)
            throw new IllegalArgumentException
                ("planarity.threads must be positive: "+threads);
        largeComponentWarning = pc.getInt("large-component-warning");
    }

    /*
     * settings from the given file layered over the defaults
     */
    public static PlanarityConfig load (File file) {
        if (!file.isFile())
            throw new IllegalArgumentException
                ("Configuration file "+file+" doesn't exist!");
        logger.info("Loading configuration from "+file);
        return new PlanarityConfig
            (ConfigFactory.parseFile(file)
             .withFallback(ConfigFactory.load()).resolve());
    }

    public String getCities () { return cities; }
    public String getConnections () { return connections; }
    public String getIdField () { return idField; }
    public String getEdgesField () { return edgesField; }
    public int getThreads () { return threads; }
    public int getLargeComponentWarning () { return largeComponentWarning; }
}
