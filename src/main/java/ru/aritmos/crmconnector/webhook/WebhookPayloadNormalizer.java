package ru.aritmos.crmconnector.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Разбор входящих webhook-уведомлений CRM в {@link WebhookEvent}.
 * <p>
 * Форма ссылки на ресурс определяется по структуре, а не по одному фиксированному ключу.
 * Поля ищутся в корне уведомления и в объекте {@code data}; порядок проверки форм:
 * <ol>
 *   <li>{@link ReferenceShape#FLAT_ID}: {@code id}, затем {@code resourceId}/{@code resourceIds},
 *       затем любое поле {@code *Id} с целым значением;</li>
 *   <li>{@link ReferenceShape#NESTED_OBJECT}: объект с целым {@code id};</li>
 *   <li>{@link ReferenceShape#URI_REFERENCE}: строка с абсолютным http(s) URI.</li>
 * </ol>
 * {@code personId} берётся из полей {@code personId}/{@code person.id}, для событий людей из самой
 * ссылки, а для заметок, звонков и сообщений из загруженного ресурса.
 * Без резолвера разбор не обращается к сети.
 */
public class WebhookPayloadNormalizer {

    private static final Logger log = LoggerFactory.getLogger(WebhookPayloadNormalizer.class);

    private static final List<String> EVENT_KEYS = List.of("event", "type", "eventName");
    private static final List<String> COLLECTION_KEYS = List.of("resourceCollection", "collection", "resource");
    private static final List<String> URI_KEYS = List.of("uri", "url", "href", "resourceUri");
    private static final Pattern TRAILING_WORD = Pattern.compile("^([a-z][A-Za-z0-9]*?)([A-Z][a-z]+)$");
    private static final Pattern VERSION_SEGMENT = Pattern.compile("v\\d+");
    private static final List<String> PERSON_KEYS = List.of("personId", "person_id");
    private static final String PEOPLE = "people";
    /** Коллекции, ресурсы которых ссылаются на человека, и путь их загрузки. */
    private static final Map<String, String> PERSON_OWNED = Map.of(
            "textMessages", "textMessages",
            "notes", "notes",
            "calls", "calls",
            "emails", "events");

    public static final Set<String> DEFAULT_COLLECTIONS = Set.of(
            "people", "peopleRelationships", "personAttachments", "notes", "calls", "textMessages",
            "emails", "events", "emEvents", "deals", "dealAttachments", "appointments", "tasks",
            "stages", "pipelines", "users", "groups", "teams", "ponds", "smartLists", "actionPlans",
            "customFields", "dealCustomFields", "threadedReplies", "reactions", "teamInboxes");

    private final ObjectMapper mapper;
    private final Set<String> knownCollections;

    public WebhookPayloadNormalizer(ObjectMapper mapper) {
        this(mapper, DEFAULT_COLLECTIONS);
    }

    public WebhookPayloadNormalizer(ObjectMapper mapper, Set<String> knownCollections) {
        this.mapper = mapper;
        this.knownCollections = knownCollections == null ? Set.of() : Set.copyOf(knownCollections);
    }

    /**
     * Разобрать тело уведомления без обращения к сети.
     *
     * @throws IllegalArgumentException если тело не JSON-объект
     */
    public WebhookEvent normalize(String rawPayload) {
        return normalize(rawPayload, null);
    }

    public WebhookEvent normalize(String rawPayload, ReferenceResolver resolver) {
        JsonNode payload;
        try {
            payload = mapper.readTree(rawPayload == null ? "" : rawPayload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Тело webhook-уведомления не является JSON: " + e.getOriginalMessage(), e);
        }
        return normalize(payload, resolver);
    }

    public WebhookEvent normalize(JsonNode payload) {
        return normalize(payload, null);
    }

    /**
     * Разобрать уведомление. Для URI-ссылки при наличии резолвера {@link ReferenceResolver#resolve}
     * вызывается ровно один раз; поиск {@code personId} может добавить одну загрузку ресурса.
     *
     * @param payload  тело уведомления
     * @param resolver резолвер URI-ссылок или {@code null}
     */
    public WebhookEvent normalize(JsonNode payload, ReferenceResolver resolver) {
        if (payload == null || !payload.isObject()) {
            throw new IllegalArgumentException("Тело webhook-уведомления должно быть JSON-объектом");
        }
        List<JsonNode> containers = containers(payload);
        String eventName = eventName(containers);
        URI uri = findUri(containers);
        String collection = collection(containers, eventName, uri);

        Reference ref = reference(containers, eventName, uri, collection, resolver);
        if (ref.shape() == ReferenceShape.NONE) {
            log.warn("[CRM][WEBHOOK] ссылка на ресурс не найдена event={} keys={}", eventName, fieldNames(payload));
        }
        Long personId = personId(containers, eventName, collection, ref, resolver);
        return new WebhookEvent(eventName, collection, ref.id(), ref.ids(), personId,
                ref.shape(), ref.unresolved(), ref.shape() == ReferenceShape.NONE ? null : uri, payload);
    }

    private record Reference(Long id, List<Long> ids, ReferenceShape shape, boolean unresolved) {

        static Reference of(Long id, ReferenceShape shape) {
            return new Reference(id, id == null ? List.of() : List.of(id), shape, id == null);
        }
    }

    private Reference reference(List<JsonNode> containers, String eventName, URI uri, String collection,
                                ReferenceResolver resolver) {
        List<Long> flatIds = flatIds(containers);
        if (!flatIds.isEmpty()) {
            return new Reference(flatIds.get(0), flatIds, ReferenceShape.FLAT_ID, false);
        }
        Long nested = nestedId(containers);
        if (nested != null) {
            return Reference.of(nested, ReferenceShape.NESTED_OBJECT);
        }
        if (uri == null) {
            return new Reference(null, List.of(), ReferenceShape.NONE, false);
        }
        if (resolver != null) {
            Optional<Long> resolved = resolver.resolve(uri, collection);
            Long id = resolved == null ? null : resolved.orElse(null);
            if (id == null) {
                log.warn("[CRM][WEBHOOK] URI-ссылка не разрешена event={} uri={}", eventName, uri);
            }
            return Reference.of(id, ReferenceShape.URI_REFERENCE);
        }
        Long fromQuery = idFromQuery(uri);
        if (fromQuery == null) {
            log.debug("[CRM][WEBHOOK] URI-ссылка оставлена неразрешённой event={} uri={}", eventName, uri);
        }
        return Reference.of(fromQuery, ReferenceShape.URI_REFERENCE);
    }

    /**
     * Идентификатор человека: прямые поля, затем сам ресурс для событий людей,
     * затем {@code personId} загруженной заметки, звонка или сообщения.
     */
    private Long personId(List<JsonNode> containers, String eventName, String collection, Reference ref,
                          ReferenceResolver resolver) {
        for (JsonNode c : containers) {
            for (String key : PERSON_KEYS) {
                Long id = asId(c.get(key));
                if (id != null) {
                    return id;
                }
            }
            JsonNode person = c.get("person");
            if (person != null && person.isObject()) {
                Long id = asId(person.get("id"));
                if (id != null) {
                    return id;
                }
            }
        }
        if (ref.id() == null) {
            return null;
        }
        if (PEOPLE.equals(collection) || (collection == null && eventName.isEmpty())) {
            return ref.id();
        }
        String owner = collection == null ? null : PERSON_OWNED.get(collection);
        if (owner == null || resolver == null) {
            return null;
        }
        Optional<JsonNode> resource = resolver.fetch(owner, ref.id());
        if (resource == null || resource.isEmpty()) {
            log.debug("[CRM][WEBHOOK] ресурс для personId не получен event={} collection={} id={}",
                    eventName, owner, ref.id());
            return null;
        }
        for (String key : PERSON_KEYS) {
            Long id = asId(resource.get().get(key));
            if (id != null) {
                return id;
            }
        }
        return null;
    }

    private static List<JsonNode> containers(JsonNode payload) {
        List<JsonNode> out = new ArrayList<>(2);
        out.add(payload);
        JsonNode data = payload.get("data");
        if (data != null && data.isObject()) {
            out.add(data);
        }
        return out;
    }

    private static String eventName(List<JsonNode> containers) {
        for (JsonNode c : containers) {
            for (String key : EVENT_KEYS) {
                String v = text(c.get(key));
                if (v != null) {
                    return v;
                }
            }
        }
        return "";
    }

    private String collection(List<JsonNode> containers, String eventName, URI uri) {
        for (JsonNode c : containers) {
            for (String key : COLLECTION_KEYS) {
                String v = text(c.get(key));
                if (v != null) {
                    return v;
                }
            }
        }
        String fromEvent = collectionFromEvent(eventName);
        if (fromEvent != null) {
            return fromEvent;
        }
        return uri == null ? null : collectionFromUri(uri);
    }

    String collectionFromEvent(String eventName) {
        if (eventName == null || eventName.isBlank()) {
            return null;
        }
        String best = null;
        for (String c : knownCollections) {
            if (eventName.startsWith(c) && eventName.length() > c.length()
                    && Character.isUpperCase(eventName.charAt(c.length()))
                    && (best == null || c.length() > best.length())) {
                best = c;
            }
        }
        if (best != null) {
            return best;
        }
        Matcher m = TRAILING_WORD.matcher(eventName);
        return m.matches() ? m.group(1) : null;
    }

    private static String collectionFromUri(URI uri) {
        String path = uri.getPath();
        if (path == null) {
            return null;
        }
        for (String segment : path.split("/")) {
            if (segment.isBlank() || VERSION_SEGMENT.matcher(segment).matches() || segment.chars().allMatch(Character::isDigit)) {
                continue;
            }
            return segment;
        }
        return null;
    }

    private static List<Long> flatIds(List<JsonNode> containers) {
        for (JsonNode c : containers) {
            Long id = asId(c.get("id"));
            if (id != null) {
                return List.of(id);
            }
            Long resourceId = asId(c.get("resourceId"));
            if (resourceId != null) {
                return List.of(resourceId);
            }
            List<Long> ids = idList(c.get("resourceIds"));
            if (!ids.isEmpty()) {
                return ids;
            }
        }
        for (JsonNode c : containers) {
            Iterator<Map.Entry<String, JsonNode>> it = c.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                String key = e.getKey();
                if (!key.endsWith("Id") || key.length() <= 2 || key.toLowerCase(Locale.ROOT).startsWith("event")) {
                    continue;
                }
                Long id = asId(e.getValue());
                if (id != null) {
                    return List.of(id);
                }
            }
        }
        return List.of();
    }

    private static Long nestedId(List<JsonNode> containers) {
        for (JsonNode c : containers) {
            JsonNode preferred = c.get("resource");
            if (preferred != null && preferred.isObject()) {
                Long id = asId(preferred.get("id"));
                if (id != null) {
                    return id;
                }
            }
            Iterator<Map.Entry<String, JsonNode>> it = c.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (e.getKey().equals("data") || !e.getValue().isObject()) {
                    continue;
                }
                Long id = asId(e.getValue().get("id"));
                if (id != null) {
                    return id;
                }
            }
        }
        return null;
    }

    private static URI findUri(List<JsonNode> containers) {
        for (JsonNode c : containers) {
            for (String key : URI_KEYS) {
                URI u = httpUri(text(c.get(key)));
                if (u != null) {
                    return u;
                }
            }
        }
        for (JsonNode c : containers) {
            Iterator<JsonNode> values = c.elements();
            while (values.hasNext()) {
                URI u = httpUri(text(values.next()));
                if (u != null) {
                    return u;
                }
            }
        }
        return null;
    }

    private static Long idFromQuery(URI uri) {
        String q = uri.getRawQuery();
        if (q == null || q.isBlank()) {
            return null;
        }
        for (String part : q.split("&")) {
            int eq = part.indexOf('=');
            if (eq > 0 && part.substring(0, eq).equals("id")) {
                String v = part.substring(eq + 1);
                return v.chars().allMatch(Character::isDigit) && !v.isEmpty() && v.length() < 19 ? Long.valueOf(v) : null;
            }
        }
        return null;
    }

    private static URI httpUri(String value) {
        if (value == null) {
            return null;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            return null;
        }
        try {
            URI u = new URI(value);
            return u.isAbsolute() && u.getHost() != null ? u : null;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static List<Long> idList(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        Set<Long> out = new LinkedHashSet<>();
        for (JsonNode n : node) {
            Long id = asId(n);
            if (id != null) {
                out.add(id);
            }
        }
        return List.copyOf(out);
    }

    /**
     * Целое значение идентификатора: число без дробной части или строка из цифр.
     */
    static Long asId(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            String s = node.asText().trim();
            if (!s.isEmpty() && s.length() < 19 && s.chars().allMatch(Character::isDigit)) {
                return Long.valueOf(s);
            }
        }
        return null;
    }

    private static String text(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        String s = node.asText().trim();
        return s.isEmpty() ? null : s;
    }

    private static List<String> fieldNames(JsonNode payload) {
        List<String> out = new ArrayList<>();
        payload.fieldNames().forEachRemaining(out::add);
        return out;
    }
}
