package adf.mappers;

import java.util.Map;

public interface FlatService {
    Map<String, FlatItem> flatToMap(String data);

    String flatToString(Map<String, FlatItem> data);

    void validate(Map<String, FlatItem> data);
}
