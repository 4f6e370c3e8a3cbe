package io.github.wphillipmoore.edgegrid.json;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.annotations.SerializedName;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Gson factory honouring {@link OmitEmpty} on the fields of any serialized class.
 *
 * <p>The reflective adapter writes the value into a tree first; annotated properties whose value is
 * empty are then removed before the tree is written out. Reading is delegated unchanged.
 */
final class OmitEmptyAdapterFactory implements TypeAdapterFactory {

  @Override
  public <T> @Nullable TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
    Set<String> omittable = omittableNames(type.getRawType());
    if (omittable.isEmpty()) {
      return null;
    }
    TypeAdapter<T> delegate = gson.getDelegateAdapter(this, type);
    TypeAdapter<JsonElement> elementAdapter = gson.getAdapter(JsonElement.class);
    return new TypeAdapter<T>() {
      @Override
      public void write(JsonWriter out, T value) throws IOException {
        JsonElement tree = delegate.toJsonTree(value);
        if (tree.isJsonObject()) {
          JsonObject object = tree.getAsJsonObject();
          for (String name : omittable) {
            JsonElement member = object.get(name);
            if (member != null && isEmpty(member)) {
              object.remove(name);
            }
          }
        }
        elementAdapter.write(out, tree);
      }

      @Override
      public T read(JsonReader in) throws IOException {
        return delegate.read(in);
      }
    };
  }

  static Set<String> omittableNames(Class<?> rawType) {
    Set<String> names = new LinkedHashSet<>();
    for (Class<?> c = rawType; c != null && c != Object.class; c = c.getSuperclass()) {
      for (Field field : c.getDeclaredFields()) {
        if (Modifier.isStatic(field.getModifiers())
            || !field.isAnnotationPresent(OmitEmpty.class)) {
          continue;
        }
        SerializedName serializedName = field.getAnnotation(SerializedName.class);
        names.add(serializedName != null ? serializedName.value() : field.getName());
      }
    }
    return names;
  }

  static boolean isEmpty(JsonElement element) {
    if (element.isJsonNull()) {
      return true;
    }
    if (element.isJsonArray()) {
      return element.getAsJsonArray().isEmpty();
    }
    if (element.isJsonObject()) {
      return element.getAsJsonObject().size() == 0;
    }
    JsonPrimitive primitive = element.getAsJsonPrimitive();
    if (primitive.isBoolean()) {
      return !primitive.getAsBoolean();
    }
    if (primitive.isNumber()) {
      return new BigDecimal(primitive.getAsString()).signum() == 0;
    }
    return primitive.getAsString().isEmpty();
  }
}
