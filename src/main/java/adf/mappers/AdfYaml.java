package adf.mappers;

import adf.Document;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

public final class AdfYaml {

    private final Yaml yaml;

    public AdfYaml() {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(false);
        options.setIndent(2);
        options.setIndicatorIndent(2);
        options.setIndentWithIndicator(true);
        this.yaml = new Yaml(options);
    }

    public String toYaml(Document document) {
        Object root = document.toStructuredCopy().toPlain();
        return yaml.dump(root);
    }
}
