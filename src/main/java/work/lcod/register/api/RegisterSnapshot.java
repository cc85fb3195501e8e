package work.lcod.register.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.register.runtime.RegisterBase;
import work.lcod.register.runtime.RegisterTable;

/**
 * Point-in-time view of a set of bases and their children, serializable to JSON.
 */
public record RegisterSnapshot(List<BaseView> bases) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RegisterSnapshot {
        bases = List.copyOf(bases);
    }

    public static RegisterSnapshot of(Collection<? extends RegisterBase<?>> bases) {
        List<BaseView> views = new ArrayList<>();
        for (RegisterBase<?> base : bases) {
            views.add(view(base));
        }
        return new RegisterSnapshot(views);
    }

    private static BaseView view(RegisterBase<?> base) {
        List<ChildView> children = new ArrayList<>();
        for (RegisterTable.Entry<?> entry : base.entries()) {
            children.add(new ChildView(entry.name(), entry.childType().getName(), entry.bound()));
        }
        return new BaseView(base.id(), base.baseType().getName(), children);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        for (BaseView base : bases) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("type", base.type());
            List<Map<String, Object>> children = new ArrayList<>();
            for (ChildView child : base.children()) {
                Map<String, Object> view = new LinkedHashMap<>();
                view.put("name", child.name());
                view.put("type", child.type());
                view.put("bound", child.bound());
                children.add(view);
            }
            entry.put("children", children);
            serializable.put(base.id(), entry);
        }
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getOriginalMessage() + "\"}";
        }
    }

    public record BaseView(String id, String type, List<ChildView> children) {
        public BaseView {
            children = List.copyOf(children);
        }

        public List<String> names() {
            return children.stream().map(ChildView::name).toList();
        }
    }

    public record ChildView(String name, String type, boolean bound) {}
}
