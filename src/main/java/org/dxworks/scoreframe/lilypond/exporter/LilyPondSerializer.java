package org.dxworks.scoreframe.lilypond.exporter;

import org.dxworks.scoreframe.ext.Direction;
import org.dxworks.scoreframe.lilypond.lexer.NoteNames;
import org.dxworks.scoreframe.lilypond.model.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes the syntax tree back as LilyPond text in one canonical layout: one line per top-level item,
 * single spaces between tokens, block bodies always braced.
 */
public final class LilyPondSerializer {

    private LilyPondSerializer() {
    }

    public static String serialize(LilyPondFile file) {
        List<String> lines = new ArrayList<>();
        if (file.version != null) {
            lines.add("\\version " + Assignment.quote(file.version));
        }
        if (file.header != null && !file.header.isEmpty()) {
            lines.add("\\header " + block(file.header));
        }
        if (file.scoreBlock) {
            StringBuilder score = new StringBuilder("\\score {");
            for (Music music : file.music) {
                score.append(' ').append(serialize(music));
            }
            for (OutputDef def : file.outputDefs) {
                score.append(' ').append(outputDef(def));
            }
            lines.add(score.append(" }").toString());
        } else {
            for (Music music : file.music) {
                lines.add(serialize(music));
            }
            for (OutputDef def : file.outputDefs) {
                lines.add(outputDef(def));
            }
        }
        return String.join("\n", lines);
    }

    public static String serialize(Music music) {
        StringBuilder sb = new StringBuilder();
        write(music, sb);
        return sb.toString();
    }

    private static void write(Music music, StringBuilder sb) {
        if (music instanceof SequentialMusic seq) {
            writeItems("{", seq.items, " ", "}", sb);
        } else if (music instanceof SimultaneousMusic sim) {
            writeItems("<<", sim.items, sim.voiceSeparated ? " \\\\ " : " ", ">>", sb);
        } else if (music instanceof NoteEvent note) {
            sb.append(pitch(note.pitch, true));
            writeRhythmicSuffix(note, sb);
        } else if (music instanceof ChordEvent chord) {
            sb.append('<');
            for (int i = 0; i < chord.pitches.size(); i++) {
                if (i > 0) {
                    sb.append(' ');
                }
                sb.append(pitch(chord.pitches.get(i), true));
            }
            sb.append('>');
            writeRhythmicSuffix(chord, sb);
        } else if (music instanceof ChordRepetition repetition) {
            sb.append('q');
            writeRhythmicSuffix(repetition, sb);
        } else if (music instanceof RestEvent rest) {
            writeRest(rest, sb);
        } else if (music instanceof TupletMusic tuplet) {
            sb.append("\\tuplet ").append(tuplet.numerator).append('/').append(tuplet.denominator);
            if (tuplet.spanDuration != null) {
                sb.append(' ').append(duration(tuplet.spanDuration));
            }
            sb.append(' ');
            writeBraced(tuplet.body, sb);
        } else if (music instanceof GraceMusic grace) {
            sb.append(switch (grace.kind) {
                case ACCIACCATURA -> "\\acciaccatura ";
                case APPOGGIATURA -> "\\appoggiatura ";
                default -> "\\grace ";
            });
            writeBraced(grace.body, sb);
        } else if (music instanceof AfterGraceMusic afterGrace) {
            sb.append("\\afterGrace ");
            if (afterGrace.fraction != null) {
                sb.append(afterGrace.fraction.numerator).append('/').append(afterGrace.fraction.denominator).append(' ');
            }
            write(afterGrace.main, sb);
            sb.append(' ');
            writeBraced(afterGrace.grace, sb);
        } else if (music instanceof RepeatMusic repeat) {
            sb.append("\\repeat ").append(repeat.kind.keyword()).append(' ').append(repeat.count).append(' ');
            writeBraced(repeat.body, sb);
            if (!repeat.alternatives.isEmpty()) {
                sb.append(" \\alternative {");
                for (Music alternative : repeat.alternatives) {
                    sb.append(' ');
                    writeBraced(alternative, sb);
                }
                sb.append(" }");
            }
        } else if (music instanceof MarkupMusic markup) {
            sb.append(markup.list ? "\\markuplist " : "\\markup ").append(markup.serialized);
        } else if (music instanceof BarCheck) {
            sb.append('|');
        } else if (music instanceof BarLine barLine) {
            sb.append("\\bar ").append(Assignment.quote(barLine.style));
        } else if (music instanceof ContextedMusic contexted) {
            sb.append('\\').append(contexted.keyword).append(' ').append(contexted.contextType);
            if (contexted.name != null) {
                sb.append(" = ").append(Assignment.quote(contexted.name));
            }
            if (contexted.with != null) {
                sb.append(" \\with ").append(block(contexted.with));
            }
            sb.append(' ');
            write(contexted.music, sb);
        } else if (music instanceof RelativeMusic relative) {
            sb.append("\\relative ");
            if (relative.reference != null) {
                sb.append(pitch(relative.reference, false)).append(' ');
            }
            write(relative.body, sb);
        } else if (music instanceof ClefChange clef) {
            sb.append("\\clef ").append(clef.name.matches("[a-zA-Z]+") ? clef.name : Assignment.quote(clef.name));
        } else if (music instanceof KeySignature key) {
            sb.append("\\key ").append(key.tonic).append(" \\").append(key.mode);
        } else if (music instanceof TimeSignature time) {
            sb.append("\\time ").append(time.numerator).append('/').append(time.denominator);
        } else {
            throw new IllegalArgumentException("Cannot serialize " + music.getClass().getSimpleName());
        }
    }

    private static void writeItems(String open, List<Music> items, String separator, String close, StringBuilder sb) {
        sb.append(open);
        for (int i = 0; i < items.size(); i++) {
            sb.append(i == 0 ? " " : separator);
            write(items.get(i), sb);
        }
        sb.append(' ').append(close);
    }

    private static void writeBraced(Music body, StringBuilder sb) {
        if (body instanceof SequentialMusic) {
            write(body, sb);
        } else {
            sb.append("{ ");
            write(body, sb);
            sb.append(" }");
        }
    }

    private static void writeRest(RestEvent rest, StringBuilder sb) {
        if (rest.position != null) {
            sb.append(pitch(rest.position, false));
            if (rest.duration != null) {
                sb.append(duration(rest.duration));
            }
            sb.append("\\rest");
            writeTremoloAndPostEvents(rest, sb);
            return;
        }
        sb.append(rest.skip ? 's' : 'r');
        writeRhythmicSuffix(rest, sb);
    }

    private static void writeRhythmicSuffix(RhythmicEvent event, StringBuilder sb) {
        if (event.duration != null) {
            sb.append(duration(event.duration));
        }
        writeTremoloAndPostEvents(event, sb);
    }

    private static void writeTremoloAndPostEvents(RhythmicEvent event, StringBuilder sb) {
        if (event.tremolo != null) {
            sb.append(':');
            if (event.tremolo > 0) {
                sb.append(event.tremolo);
            }
        }
        for (PostEvent postEvent : event.postEvents) {
            sb.append(postEvent(postEvent));
        }
    }

    static String postEvent(PostEvent postEvent) {
        return switch (postEvent.kind) {
            case TIE -> "~";
            case SLUR_START -> "(";
            case SLUR_END -> ")";
            case PHRASING_SLUR_START -> "\\(";
            case PHRASING_SLUR_END -> "\\)";
            case BEAM_START -> "[";
            case BEAM_END -> "]";
            case CRESCENDO -> "\\<";
            case DECRESCENDO -> "\\>";
            case HAIRPIN_END -> "\\!";
            case DYNAMIC, SCRIPT -> directionPrefix(postEvent.direction, "") + "\\" + postEvent.name;
            case STRING_NUMBER -> directionPrefix(postEvent.direction, "") + "\\" + postEvent.name;
            case ABBREVIATED_SCRIPT, FINGERING -> directionPrefix(postEvent.direction, "-") + postEvent.name;
        };
    }

    private static String directionPrefix(Direction direction, String neutral) {
        if (direction == null) {
            return neutral;
        }
        return switch (direction) {
            case UP -> "^";
            case DOWN -> "_";
            case NEUTRAL -> neutral;
        };
    }

    static String pitch(Pitch pitch, boolean withAccidentalFlags) {
        StringBuilder sb = new StringBuilder(NoteNames.spell(pitch.step, pitch.alter));
        String mark = pitch.octave > 0 ? "'" : ",";
        sb.append(mark.repeat(Math.abs(pitch.octave)));
        if (withAccidentalFlags) {
            if (pitch.forcedAccidental) {
                sb.append('!');
            } else if (pitch.cautionaryAccidental) {
                sb.append('?');
            }
        }
        return sb.toString();
    }

    static String duration(Duration duration) {
        return duration.base + ".".repeat(duration.dots);
    }

    private static String block(List<Assignment> assignments) {
        StringBuilder sb = new StringBuilder("{");
        for (Assignment assignment : assignments) {
            sb.append(' ').append(assignment.key).append(" = ").append(assignment.value);
        }
        return sb.append(" }").toString();
    }

    private static String outputDef(OutputDef def) {
        return "\\" + def.kind + " " + block(def.assignments);
    }
}
