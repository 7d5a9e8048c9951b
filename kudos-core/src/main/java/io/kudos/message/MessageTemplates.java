package io.kudos.message;

import io.kudos.MessageType;

import java.util.List;
import java.util.Objects;

/**
 * Built-in message templates. {@code :name} is replaced with the recipient name.
 */
final class MessageTemplates {
    static final String NAME_PLACEHOLDER = ":name";

    static final List<MessageTemplate> ALL = List.of(
            new MessageTemplate(MessageType.ANIMAL, "You've navigated this week like a bear navigates its way to honey, :name."),
            new MessageTemplate(MessageType.ANIMAL, "You attacked those tasks like a caffeinated squirrel at a bird feeder, :name."),
            new MessageTemplate(MessageType.ANIMAL, "You've been as dependable as a salmon swimming upstream, :name. But with less flopping."),
            new MessageTemplate(MessageType.ANIMAL, "You herded those deadlines like a border collie at a sheep convention, :name."),
            new MessageTemplate(MessageType.ANIMAL, "You carried this week like a mother duck crossing a highway, :name. Fearlessly."),
            new MessageTemplate(MessageType.ANIMAL, "You worked with the quiet determination of an ant carrying a crumb ten times its size, :name."),
            new MessageTemplate(MessageType.ANIMAL, "You were busier than a one-legged cat in a sandbox, :name. And somehow you made it look elegant."),
            new MessageTemplate(MessageType.ABSURD, "If productivity were an Olympic sport, you'd be disqualified for being suspiciously good, :name."),
            new MessageTemplate(MessageType.ABSURD, "You crushed it so hard this week, :name, geologists want to study the impact site."),
            new MessageTemplate(MessageType.ABSURD, "Scientists are baffled by your output, :name. They're calling it 'unreasonably effective.'"),
            new MessageTemplate(MessageType.ABSURD, "Your work ethic this week was so intense, :name, CERN wants to know if you've discovered a new energy source."),
            new MessageTemplate(MessageType.ABSURD, "NASA called, :name. They want to study your trajectory because it only goes up."),
            new MessageTemplate(MessageType.ABSURD, "Your output this week broke the simulation, :name. The devs are still patching it."),
            new MessageTemplate(MessageType.ABSURD, "The dictionary just called, :name. They're replacing the word 'impressive' with your photo."),
            new MessageTemplate(MessageType.META, "This automated message thinks you're great, :name. It's never wrong."),
            new MessageTemplate(MessageType.META, "A computer is telling you you're awesome, :name. The machines are on your side."),
            new MessageTemplate(MessageType.META, "I'm just an API, :name, but even I can see you're crushing it."),
            new MessageTemplate(MessageType.META, "This compliment was generated at 200 OK, :name. No errors detected in your performance."),
            new MessageTemplate(MessageType.META, "According to my algorithms, :name, you are statistically awesome. Sample size: this week."),
            new MessageTemplate(MessageType.UNEXPECTED, "You didn't just meet expectations, :name. You took expectations out for dinner and showed them a lovely time."),
            new MessageTemplate(MessageType.UNEXPECTED, "You handled this week like a diplomat handles a buffet, :name - with grace and efficiency."),
            new MessageTemplate(MessageType.UNEXPECTED, "Your work this week had the same energy as finding money in your coat pocket, :name. A delightful surprise."),
            new MessageTemplate(MessageType.UNEXPECTED, "You brought the same energy to Monday that most people save for Friday, :name."),
            new MessageTemplate(MessageType.UNEXPECTED, "Somewhere out there, a motivational poster is quoting you, :name."),
            new MessageTemplate(MessageType.TOUGH_LOVE, "Solid work, :name. Not legendary, but solid. Take 2 days off and come back hungry."),
            new MessageTemplate(MessageType.TOUGH_LOVE, "You survived, :name. That's the bar, and you cleared it. Barely. Rest up."),
            new MessageTemplate(MessageType.TOUGH_LOVE, "Adequate, :name. The word you're looking for is adequate. Now go away for 2 days."),
            new MessageTemplate(MessageType.TOUGH_LOVE, "I've seen better, :name. But I've also seen worse. Take 2 days to recalibrate."),
            new MessageTemplate(MessageType.TOUGH_LOVE, "You did the thing, :name. Not with flair, but you did it. Go rest."),
            new MessageTemplate(MessageType.TOUGH_LOVE, "Look, :name, nobody's writing songs about this week. But nobody's filing complaints either. Take 2 days.")
    );

    private MessageTemplates() {
    }

    record MessageTemplate(MessageType type, String template) {
        MessageTemplate {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(template, "template");
        }

        boolean isToughLove() {
            return type == MessageType.TOUGH_LOVE;
        }
    }
}
