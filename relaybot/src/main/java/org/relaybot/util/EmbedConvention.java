package org.relaybot.util;

import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.entities.MessageEmbed;

import java.awt.Color;
import java.util.ArrayList;
import java.util.List;

/**
 * House style for bot embeds: a colored title/description pair with optional fields and footer.
 */
public class EmbedConvention {

    public static final Color INFO = new Color(78, 161, 177);
    public static final Color SUCCESS = new Color(42, 168, 115);
    public static final Color WARN = new Color(205, 136, 55);
    public static final Color ERROR = new Color(239, 79, 79);

    private String title;
    private String description;
    private Color color = INFO;
    private String footer;
    private final List<MessageEmbed.Field> fields = new ArrayList<>();

    public static EmbedConvention info(String title, String description) {
        return new EmbedConvention().setTitle("ℹ️ " + title).setDescription(description).setColor(INFO);
    }

    public static EmbedConvention success(String title, String description) {
        return new EmbedConvention().setTitle("✅ " + title).setDescription(description).setColor(SUCCESS);
    }

    public static EmbedConvention warn(String title, String description) {
        return new EmbedConvention().setTitle("⚠️ " + title).setDescription(description).setColor(WARN);
    }

    public static EmbedConvention error(String title, String description) {
        return new EmbedConvention().setTitle("❌ " + title).setDescription(description).setColor(ERROR);
    }

    public EmbedConvention setTitle(String title) {
        this.title = title;
        return this;
    }

    public EmbedConvention setDescription(String description) {
        this.description = description;
        return this;
    }

    public EmbedConvention setColor(Color color) {
        this.color = color;
        return this;
    }

    public EmbedConvention setFooter(String footer) {
        this.footer = footer;
        return this;
    }

    public EmbedConvention addField(String name, String value, boolean inline) {
        fields.add(new MessageEmbed.Field(name, value, inline));
        return this;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public List<MessageEmbed.Field> getFields() {
        return List.copyOf(fields);
    }

    public boolean isEmpty() {
        return isBlank(title) && isBlank(description) && isBlank(footer) && fields.isEmpty();
    }

    public MessageEmbed toEmbed() {
        EmbedBuilder embed = new EmbedBuilder()
                .setTitle(isBlank(title) ? null : title)
                .setDescription(isBlank(description) ? null : description)
                .setColor(color);
        for (MessageEmbed.Field field : fields) {
            embed.addField(field);
        }
        if (!isBlank(footer)) {
            embed.setFooter(footer);
        }
        return embed.build();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
