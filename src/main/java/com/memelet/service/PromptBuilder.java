package com.memelet.service;

import com.memelet.model.MediaType;
import com.memelet.model.Tag;

import java.util.List;

/**
 * Builds the prompts sent with every analysis request.
 * The user prompt asks for one JSON object with five descriptive fields, plus a {@code tags}
 * field when the vocabulary has tags the model is allowed to suggest.
 */
public class PromptBuilder {

    public static final String SYSTEM_PROMPT =
            "You're a meme expert. You're very smart and see meanings between the lines. "
            + "You know all famous persons and all characters from every show, movie and game. "
            + "Use correct meme names (like Pepe, Wojak, etc.) and media references.";

    private static final String FIELDS = """
            references: "Analyze the %1$s to see if it features any famous persons or characters from movies, shows, cartoons or games. If it does, put that information here. If not, omit",
            template: "If the %1$s features an established meme character or template (such as 'trollface', 'wojak', 'Pepe the Frog', 'Loss'), name it here, otherwise omit",
            caption: "If the %1$s includes any captions, put them here in the original language, otherwise omit",
            description: "Describe the %1$s with its captions (if any) in mind",
            meaning: "Explain what this meme means, using information you determined earlier\"""";

    private static final String TAGS_FIELD = """
            ,
            tags: "Comma-separated list of tags that apply to this meme. Choose ONLY from the list below, use the names exactly as written, and omit the field if none apply\"""";

    public String buildSystemPrompt() {
        return SYSTEM_PROMPT;
    }

    /**
     * @param type            media type of the record
     * @param sampleCount     number of images attached to the request
     * @param suggestibleTags tags the model may choose from; the tags field is left out when empty
     */
    public String buildUserPrompt(MediaType type, int sampleCount, List<Tag> suggestibleTags) {
        StringBuilder prompt = new StringBuilder();
        prompt.append(introFor(type, sampleCount));
        prompt.append(" Analyze it and return json of the following structure: {");
        prompt.append(String.format(FIELDS, subjectFor(type)));

        if (!suggestibleTags.isEmpty()) {
            prompt.append(TAGS_FIELD);
            prompt.append("}");
            prompt.append("\n\n").append(buildTagsFragment(suggestibleTags));
        } else {
            prompt.append("}");
        }
        return prompt.toString();
    }

    /**
     * One {@code - name: description} line per tag.
     */
    public String buildTagsFragment(List<Tag> tags) {
        StringBuilder fragment = new StringBuilder("Available tags:");
        for (Tag tag : tags) {
            fragment.append("\n- ").append(tag.getName());
            if (tag.getDescription() != null && !tag.getDescription().isBlank()) {
                fragment.append(": ").append(tag.getDescription().trim());
            }
        }
        return fragment.toString();
    }

    private String introFor(MediaType type, int sampleCount) {
        switch (type) {
            case GIF:
                return "These " + sampleCount + " images are frames sampled in order from an animated GIF meme.";
            case VIDEO:
                return "These " + sampleCount + " images are frames sampled in order from a video meme.";
            case ALBUM:
                return "These " + sampleCount + " images form a single meme, an album meant to be read in the given order.";
            case IMAGE:
            default:
                return "This image is a meme.";
        }
    }

    private String subjectFor(MediaType type) {
        switch (type) {
            case GIF:
                return "GIF";
            case VIDEO:
                return "video";
            case ALBUM:
                return "album";
            case IMAGE:
            default:
                return "image";
        }
    }
}
