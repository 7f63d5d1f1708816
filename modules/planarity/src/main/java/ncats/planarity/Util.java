package ncats.planarity;

import java.util.logging.Level;
import java.util.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

public class Util {
    static final Logger logger = Logger.getLogger(Util.class.getName());

    private Util () {}

    public static String toJson (Object obj) {
        if (obj != null) {
            try {
                ObjectMapper mapper = new ObjectMapper ();
                return mapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(obj);
            }
            catch (Exception ex) {
                logger.log(Level.SEVERE, "Can't serialize object to json", ex);
            }
        }
        return null;
    }
}
