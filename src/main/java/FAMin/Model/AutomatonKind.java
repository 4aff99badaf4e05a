package FAMin.Model;

public enum AutomatonKind {
    DA,
    NA
}
