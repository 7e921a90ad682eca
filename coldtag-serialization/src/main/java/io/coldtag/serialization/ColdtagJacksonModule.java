package io.coldtag.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.coldtag.core.function.FunctionConfig;
import io.coldtag.core.reading.Reading;
import io.coldtag.core.result.FunctionResult;
import io.coldtag.core.result.FunctionStatus;
import io.coldtag.core.tag.Tag;
import io.coldtag.core.tag.TagType;
import io.coldtag.serialization.mixin.FunctionConfigBuilderMixin;
import io.coldtag.serialization.mixin.FunctionConfigMixin;
import io.coldtag.serialization.mixin.FunctionResultBuilderMixin;
import io.coldtag.serialization.mixin.FunctionResultMixin;
import io.coldtag.serialization.mixin.TagBuilderMixin;
import io.coldtag.serialization.mixin.TagMixin;
import java.io.Serial;
import java.time.ZoneId;

/// Jackson `SimpleModule` that registers all Coldtag serialization configuration in one place.
///
/// Covers two registration strategies:
///
/// **Custom serializer/deserializer pairs** (wire ids and lenient input):
/// - `TagType` as its lower-case id (`"location"`, `"datetime"`)
/// - `FunctionStatus` as `"success"` / `"error"`
/// - `Reading` as a flat object with a lenient timestamp
///
/// **Mixin/builder pairs** (immutable builder-pattern domain objects):
/// - `Tag` + `Tag.Builder`
/// - `FunctionConfig` + `FunctionConfig.Builder`
/// - `FunctionResult` + `FunctionResult.Builder`
///
/// @implNote All registrations are explicit; no classpath scanning.
/// @see ColdtagSerializer for the convenience factory API
public class ColdtagJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 5523010387243781925L;

    /// Constructs the module reading epoch and offset timestamps in the system zone.
    public ColdtagJacksonModule() {
        this(ZoneId.systemDefault());
    }

    /// Constructs the module.
    ///
    /// @param zone zone used to turn epoch and offset reading timestamps into local time,
    ///     not null
    public ColdtagJacksonModule(ZoneId zone) {
        super("ColdtagJacksonModule");

        addSerializer(TagType.class, new TagTypeSerializer());
        addDeserializer(TagType.class, new TagTypeDeserializer());

        addSerializer(FunctionStatus.class, new FunctionStatusSerializer());
        addDeserializer(FunctionStatus.class, new FunctionStatusDeserializer());

        addSerializer(Reading.class, new ReadingSerializer());
        addDeserializer(Reading.class, new ReadingDeserializer(zone));
    }

    /// Applies mixin annotations to builder-pattern domain types.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Tag.class, TagMixin.class);
        context.setMixInAnnotations(Tag.Builder.class, TagBuilderMixin.class);

        context.setMixInAnnotations(FunctionConfig.class, FunctionConfigMixin.class);
        context.setMixInAnnotations(FunctionConfig.Builder.class, FunctionConfigBuilderMixin.class);

        context.setMixInAnnotations(FunctionResult.class, FunctionResultMixin.class);
        context.setMixInAnnotations(FunctionResult.Builder.class, FunctionResultBuilderMixin.class);
    }
}
