package fun.fengwk.mph.core.service.convert.backend;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Named registry of conversion backends.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ConversionBackendRegistry {

    private final Map<String, ConversionBackend> backends = new LinkedHashMap<>();

    public ConversionBackendRegistry(List<ConversionBackend> backends) {
        for (ConversionBackend backend : backends) {
            ConversionBackend previous = this.backends.put(backend.name(), backend);
            if (previous != null) {
                log.warn("duplicate conversion backend, name={}, replaced={}", backend.name(), previous.getClass().getName());
            }
        }
    }

    public Optional<ConversionBackend> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(backends.get(name));
    }

    public Set<String> names() {
        return backends.keySet();
    }

}
