package org.carball.advisor.knowledge;

import java.util.List;

/**
 * The built-in pattern catalog. Pattern keys here are the only names the
 * detectors may emit.
 */
public final class BuiltinPatterns {

    public static final String SINGLETON = "singleton";
    public static final String FACTORY = "factory";
    public static final String OBSERVER = "observer";
    public static final String STRATEGY = "strategy";
    public static final String COMMAND = "command";
    public static final String BUILDER = "builder";
    public static final String ADAPTER = "adapter";
    public static final String DECORATOR = "decorator";
    public static final String STATE = "state";
    public static final String REPOSITORY = "repository";

    private BuiltinPatterns() {
    }

    public static KnowledgeBase createDefault() {
        return new KnowledgeBase(List.of(
                singleton(),
                factory(),
                observer(),
                strategy(),
                command(),
                builder(),
                adapter(),
                decorator(),
                state(),
                repository()
        ));
    }

    private static PatternKnowledge singleton() {
        return PatternKnowledge.builder()
                .key(SINGLETON)
                .name("Singleton Pattern")
                .category(PatternCategory.CREATIONAL)
                .description("Ensures a class has only one instance with global access")
                .whenToUse(PatternCriteria.builder()
                        .minimumComplexity(ComplexityLevel.MODERATE)
                        .indicators(List.of("single instance", "only one", "global access", "shared state",
                                "database connection", "configuration", "logging", "cache"))
                        .threshold("expensive_creation", 1)
                        .threshold("global_access_points", 2)
                        .useCase("Database connections - expensive to create, should be shared")
                        .useCase("Configuration settings - one source of truth needed")
                        .useCase("Logging systems - centralized logging required")
                        .useCase("Caching mechanisms - shared cache across application")
                        .benefits(List.of("Controlled access to sole instance", "Reduced memory footprint",
                                "Global access point", "Lazy initialization"))
                        .build())
                .whenNotToUse(AntiPatternCriteria.builder()
                        .redFlags(List.of("just want global variables", "testing is important",
                                "multiple instances later", "simple objects", "data models",
                                "user objects", "entity classes"))
                        .scenarioToAvoid("You just want global variables - use static utility methods or constants instead")
                        .scenarioToAvoid("Testing is important - singletons are hard to test and mock")
                        .scenarioToAvoid("You might need multiple instances later - don't paint yourself into a corner")
                        .scenarioToAvoid("Simple objects - don't over-engineer basic data structures")
                        .scenarioToAvoid("Data models - User, Product, Order should NOT be singletons")
                        .betterAlternatives(List.of("Static constants for simple global state",
                                "Dependency injection for better testability",
                                "Configuration objects passed as parameters",
                                "try-with-resources for resource control"))
                        .commonMistakes(List.of("Not handling thread safety in concurrent environments",
                                "Using for data objects (User, Product entities)",
                                "Overuse - creating singletons when regular classes suffice",
                                "Making everything singleton for 'consistency'"))
                        .build())
                .advanced(AdvancedScenarios.builder()
                        .threadingConsiderations("Use double-checked locking on a volatile field, or the holder-class idiom")
                        .performanceImplications("Lazy initialization improves startup; eager initialization suits heavily used instances")
                        .testingChallenges("Hard to mock; state leaks between tests unless it can be reset")
                        .optimizationTips("An enum with a single constant gives serialization-safe instance control")
                        .enterpriseConsiderations("Singletons do not span processes; document the lifecycle")
                        .build())
                .alternatives(List.of("Static constants", "Dependency injection", "Monostate pattern", "Registry pattern"))
                .complexityScore(6)
                .learningDifficulty(4)
                .build();
    }

    private static PatternKnowledge factory() {
        return PatternKnowledge.builder()
                .key(FACTORY)
                .name("Factory Pattern")
                .category(PatternCategory.CREATIONAL)
                .description("Creates objects without specifying their exact classes")
                .whenToUse(PatternCriteria.builder()
                        .minimumComplexity(ComplexityLevel.MODERATE)
                        .indicators(List.of("create different types", "multiple classes", "configuration-driven",
                                "switch implementations", "object creation", "similar classes"))
                        .threshold("similar_classes", 3)
                        .threshold("creation_complexity", 5)
                        .threshold("type_check_chain", 2)
                        .threshold("creation_returns", 2)
                        .threshold("distinct_types", 2)
                        .useCase("3+ similar classes that do the same job differently")
                        .useCase("Complex object creation requiring multiple steps or decisions")
                        .useCase("Configuration-driven creation - object type depends on config")
                        .useCase("Need to switch implementations at runtime")
                        .benefits(List.of("Decouples object creation from usage",
                                "Easy to add new types without changing client code",
                                "Centralizes creation logic", "Supports polymorphism"))
                        .build())
                .whenNotToUse(AntiPatternCriteria.builder()
                        .redFlags(List.of("only one class", "simple object creation", "over-engineering",
                                "performance critical", "just in case"))
                        .scenarioToAvoid("Only one class - don't create a factory for just one type")
                        .scenarioToAvoid("Simple object creation - if new MyClass() is simple enough")
                        .scenarioToAvoid("Over-engineering - don't add factories 'just in case'")
                        .scenarioToAvoid("Performance critical sections - factories add small overhead")
                        .betterAlternatives(List.of("Method parameters for small variations",
                                "Enums with switch statements for fixed options",
                                "Configuration files for simple behavior changes",
                                "Direct instantiation for simple cases"))
                        .commonMistakes(List.of("Creating factory for single class",
                                "Adding factory complexity before it's needed",
                                "Not using polymorphism effectively"))
                        .build())
                .advanced(AdvancedScenarios.builder()
                        .threadingConsiderations("Factory methods called concurrently must be thread-safe, including any caches")
                        .performanceImplications("Consider pooling expensive products and caching the factories themselves")
                        .testingChallenges("Mock the factory for client tests; verify the product type per input")
                        .optimizationTips("Simple Factory for basics, Factory Method for subclass choice, Abstract Factory for families")
                        .enterpriseConsiderations("Consider a plugin architecture with factory registration")
                        .build())
                .alternatives(List.of("Direct instantiation", "Builder pattern for complex construction",
                        "Prototype pattern for cloning", "Service locator pattern"))
                .complexityScore(5)
                .learningDifficulty(3)
                .build();
    }

    private static PatternKnowledge observer() {
        return PatternKnowledge.builder()
                .key(OBSERVER)
                .name("Observer Pattern")
                .category(PatternCategory.BEHAVIORAL)
                .description("Defines one-to-many dependency between objects for automatic notifications")
                .whenToUse(PatternCriteria.builder()
                        .minimumComplexity(ComplexityLevel.MODERATE)
                        .indicators(List.of("subscribe", "notify", "listen", "event", "update", "broadcast",
                                "model-view", "real-time", "multiple listeners", "one-to-many"))
                        .threshold("observers", 2)
                        .threshold("event_types", 1)
                        .threshold("update_frequency", 1)
                        .useCase("Model-View architectures - views update when model changes")
                        .useCase("Event-driven systems - user actions, system events")
                        .useCase("Real-time updates - stock prices, chat, live dashboards")
                        .useCase("One-to-many relationships - one subject, many observers")
                        .benefits(List.of("Loose coupling between subject and observers",
                                "Dynamic relationships - add/remove observers at runtime",
                                "Broadcast communication", "Supports event-driven architectures"))
                        .build())
                .whenNotToUse(AntiPatternCriteria.builder()
                        .redFlags(List.of("simple data binding", "performance critical", "complex update sequences",
                                "only one observer", "order dependencies"))
                        .scenarioToAvoid("Simple data binding - direct references might be simpler")
                        .scenarioToAvoid("Performance critical code - notification adds overhead")
                        .scenarioToAvoid("Complex update sequences - order dependencies make it confusing")
                        .scenarioToAvoid("Only one observer - direct method calls are clearer")
                        .betterAlternatives(List.of("Direct method calls for single observer",
                                "Callbacks for simple notifications",
                                "Event queues for decoupled async communication",
                                "Property setters for simple data binding"))
                        .commonMistakes(List.of("Forgetting to unsubscribe - leads to memory leaks",
                                "Circular dependencies - Observer A updates Observer B which updates A",
                                "Complex update chains - hard to debug event propagation",
                                "Not considering notification order"))
                        .build())
                .advanced(AdvancedScenarios.builder()
                        .threadingConsiderations("Guard the observer list, e.g. with CopyOnWriteArrayList; consider async dispatch")
                        .performanceImplications("Push is efficient, pull is flexible; filter events to cut noise")
                        .testingChallenges("Mock observers; test registration, removal and notification order")
                        .optimizationTips("Weak references prevent leaks; batch notifications when possible")
                        .enterpriseConsiderations("Document event contracts; plan for distributed observers via message queues")
                        .build())
                .alternatives(List.of("Callbacks", "Event queues/message brokers", "Reactive streams",
                        "Signals/slots mechanism"))
                .complexityScore(6)
                .learningDifficulty(5)
                .build();
    }

    private static PatternKnowledge strategy() {
        return PatternKnowledge.builder()
                .key(STRATEGY)
                .name("Strategy Pattern")
                .category(PatternCategory.BEHAVIORAL)
                .description("Defines family of algorithms and makes them interchangeable")
                .whenToUse(PatternCriteria.builder()
                        .minimumComplexity(ComplexityLevel.MODERATE)
                        .indicators(List.of("multiple algorithms", "different ways", "switch algorithm",
                                "runtime selection", "eliminate conditionals", "A/B testing"))
                        .threshold("algorithms", 3)
                        .threshold("high_confidence_algorithms", 4)
                        .threshold("conditional_lines", 10)
                        .threshold("algorithm_complexity", 5)
                        .useCase("3+ algorithms for the same problem (sorting, compression)")
                        .useCase("Runtime algorithm switching based on data or user preference")
                        .useCase("Eliminating conditionals - replace long if/else chains")
                        .useCase("A/B testing - easily switch between implementations")
                        .benefits(List.of("Easy to add new algorithms", "Runtime algorithm selection",
                                "Eliminates conditional statements", "Each algorithm can be tested separately"))
                        .build())
                .whenNotToUse(AntiPatternCriteria.builder()
                        .redFlags(List.of("only one algorithm", "simple variations", "algorithms rarely change",
                                "performance critical", "two simple cases"))
                        .scenarioToAvoid("Only one algorithm - don't create strategies for single implementations")
                        .scenarioToAvoid("Simple variations - use parameters instead of separate strategies")
                        .scenarioToAvoid("Algorithms rarely change - if you'll never switch, don't add overhead")
                        .scenarioToAvoid("Performance critical - strategy adds method call overhead")
                        .betterAlternatives(List.of("Method parameters for small variations",
                                "Configuration objects for behavior customization",
                                "Template methods for algorithms with similar structure",
                                "Simple if/else for 2-3 cases"))
                        .commonMistakes(List.of("Creating strategy for single algorithm",
                                "Not making strategies truly interchangeable",
                                "Over-engineering simple conditional logic"))
                        .build())
                .advanced(AdvancedScenarios.builder()
                        .threadingConsiderations("Keep strategies stateless; selection logic must be thread-safe")
                        .performanceImplications("Cache strategy instances; profile strategies against each other")
                        .testingChallenges("Test each strategy alone and the selection logic separately")
                        .optimizationTips("Select by input characteristics; combine with Factory for creation")
                        .enterpriseConsiderations("Document selection criteria; version strategies for compatibility")
                        .build())
                .alternatives(List.of("Lambdas and functional interfaces", "Template method pattern",
                        "State pattern for behavior changes", "Command pattern for action selection"))
                .complexityScore(4)
                .learningDifficulty(3)
                .build();
    }

    private static PatternKnowledge command() {
        return PatternKnowledge.builder()
                .key(COMMAND)
                .name("Command Pattern")
                .category(PatternCategory.BEHAVIORAL)
                .description("Encapsulates requests as objects to parameterize and queue operations")
                .whenToUse(PatternCriteria.builder()
                        .minimumComplexity(ComplexityLevel.MODERATE)
                        .indicators(List.of("undo", "redo", "queue", "macro", "log operations",
                                "parameterize objects", "decouple invoker", "store operations"))
                        .threshold("operations_to_track", 1)
                        .threshold("macro_commands", 2)
                        .threshold("queue_size", 1)
                        .useCase("Undo/redo operations - commands store state for reversal")
                        .useCase("Macro recording - combine multiple commands")
                        .useCase("Queue operations - store commands for later execution")
                        .useCase("Logging and auditing - track all operations performed")
                        .benefits(List.of("Decouples invoker from receiver", "Commands can be stored and queued",
                                "Supports undo/redo functionality", "Easy to create macro commands"))
                        .build())
                .whenNotToUse(AntiPatternCriteria.builder()
                        .redFlags(List.of("simple operations", "no undo needed", "performance critical",
                                "tight coupling acceptable", "basic getters"))
                        .scenarioToAvoid("Simple operations - don't create commands for basic method calls")
                        .scenarioToAvoid("No undo needed - if operations are irreversible and logging not needed")
                        .scenarioToAvoid("Performance critical - command objects add overhead")
                        .scenarioToAvoid("Tight coupling acceptable - when invoker can directly call receiver")
                        .betterAlternatives(List.of("Direct method calls for simple operations",
                                "Functional interfaces for parameterization",
                                "Event systems for decoupling",
                                "Transaction objects for complex operations"))
                        .commonMistakes(List.of("Creating commands for every operation",
                                "Not implementing proper undo logic", "Making commands too granular"))
                        .build())
                .advanced(AdvancedScenarios.builder()
                        .threadingConsiderations("Make commands immutable; synchronize queues and the undo stack")
                        .performanceImplications("Bound the undo history; pool frequently used commands")
                        .testingChallenges("Test execute and undo separately; mock receivers")
                        .optimizationTips("Worth it for undoable or queued operations, overkill for accessors")
                        .enterpriseConsiderations("Version and serialize commands when they are persisted")
                        .build())
                .alternatives(List.of("Direct method calls", "Lambdas", "Event sourcing", "Transaction scripts"))
                .complexityScore(6)
                .learningDifficulty(5)
                .build();
    }

    private static PatternKnowledge builder() {
        return PatternKnowledge.builder()
                .key(BUILDER)
                .name("Builder Pattern")
                .category(PatternCategory.CREATIONAL)
                .description("Constructs complex objects step by step with fluent interface")
                .whenToUse(PatternCriteria.builder()
                        .minimumComplexity(ComplexityLevel.MODERATE)
                        .indicators(List.of("complex construction", "many parameters", "optional parameters",
                                "step by step", "fluent interface", "validation during construction"))
                        .threshold("constructor_parameters", 5)
                        .threshold("high_confidence_parameters", 7)
                        .threshold("high_effort_parameters", 8)
                        .threshold("optional_parameters", 3)
                        .threshold("construction_steps", 3)
                        .useCase("Objects with many optional parameters (5+ parameters)")
                        .useCase("Step-by-step construction with validation at each step")
                        .useCase("Immutable objects that need complex construction")
                        .useCase("Objects where construction order matters")
                        .benefits(List.of("Readable object construction", "Handles optional parameters elegantly",
                                "Validates during construction", "Supports fluent interface"))
                        .build())
                .whenNotToUse(AntiPatternCriteria.builder()
                        .redFlags(List.of("few properties", "simple construction", "no variation in process",
                                "performance critical", "immutable not needed"))
                        .scenarioToAvoid("Few properties - don't use builder for 2-3 simple parameters")
                        .scenarioToAvoid("Simple construction - regular constructor is clearer")
                        .scenarioToAvoid("No variation in process - builder adds unnecessary complexity")
                        .scenarioToAvoid("Performance critical - builder adds method call overhead")
                        .betterAlternatives(List.of("Regular constructors for simple objects",
                                "Records for data carriers",
                                "Factory methods for complex creation logic",
                                "Overloaded constructors for a few optional parameters"))
                        .commonMistakes(List.of("Using builder for simple objects",
                                "Not validating during construction",
                                "Making builder mutable when building immutable objects"))
                        .build())
                .advanced(AdvancedScenarios.builder()
                        .threadingConsiderations("Never share a builder between threads; build immutable products")
                        .performanceImplications("Builder allocation and chaining add small overhead")
                        .testingChallenges("Test validation at each step and each construction path")
                        .optimizationTips("Validate in build(); keep the fluent interface readable")
                        .enterpriseConsiderations("Document required versus optional steps")
                        .build())
                .alternatives(List.of("Records", "Factory methods", "Overloaded constructors", "Configuration objects"))
                .complexityScore(5)
                .learningDifficulty(4)
                .build();
    }

    private static PatternKnowledge adapter() {
        return PatternKnowledge.builder()
                .key(ADAPTER)
                .name("Adapter Pattern")
                .category(PatternCategory.STRUCTURAL)
                .description("Allows incompatible interfaces to work together")
                .whenToUse(PatternCriteria.builder()
                        .minimumComplexity(ComplexityLevel.SIMPLE)
                        .indicators(List.of("incompatible interfaces", "third-party integration", "legacy system",
                                "cannot modify", "interface mismatch", "wrapper needed"))
                        .threshold("interface_differences", 1)
                        .threshold("modification_restrictions", 1)
                        .useCase("Incompatible interfaces between existing classes")
                        .useCase("Third-party library integration with different interface")
                        .useCase("Legacy system integration without modifying old code")
                        .useCase("Making old interface work with new system")
                        .benefits(List.of("Reuses existing code without modification",
                                "Separates interface concerns from business logic",
                                "Allows incompatible classes to work together",
                                "Follows open/closed principle"))
                        .build())
                .whenNotToUse(AntiPatternCriteria.builder()
                        .redFlags(List.of("interfaces already compatible", "can modify existing classes",
                                "too complex adaptation", "performance critical"))
                        .scenarioToAvoid("Interfaces already compatible - no adapter needed")
                        .scenarioToAvoid("Can modify existing classes - direct modification is simpler")
                        .scenarioToAvoid("Too complex adaptation - consider redesigning interfaces")
                        .scenarioToAvoid("Performance critical - adapter adds indirection overhead")
                        .betterAlternatives(List.of("Direct interface modification if possible",
                                "Interface inheritance for compatible types",
                                "Composition for simple wrapping",
                                "Facade pattern for complex subsystem integration"))
                        .commonMistakes(List.of("Over-adapting simple interface differences",
                                "Not handling all methods of adapted interface",
                                "Making adapter do too much business logic"))
                        .build())
                .advanced(AdvancedScenarios.builder()
                        .threadingConsiderations("Delegate threading concerns to the adaptee")
                        .performanceImplications("One level of indirection; cache expensive conversions")
                        .testingChallenges("Test against a mock adaptee; cover every adapted method")
                        .optimizationTips("Keep adapters thin; prefer object adapters for runtime flexibility")
                        .enterpriseConsiderations("Version adapters along with the APIs they bridge")
                        .build())
                .alternatives(List.of("Direct interface modification", "Facade pattern", "Wrapper methods",
                        "Interface inheritance"))
                .complexityScore(3)
                .learningDifficulty(2)
                .build();
    }

    private static PatternKnowledge decorator() {
        return PatternKnowledge.builder()
                .key(DECORATOR)
                .name("Decorator Pattern")
                .category(PatternCategory.STRUCTURAL)
                .description("Adds behavior to objects dynamically without altering structure")
                .whenToUse(PatternCriteria.builder()
                        .minimumComplexity(ComplexityLevel.MODERATE)
                        .indicators(List.of("add responsibilities", "multiple features", "transparent enhancement",
                                "composable behaviors", "avoid inheritance explosion"))
                        .threshold("optional_features", 3)
                        .threshold("feature_combinations", 4)
                        .threshold("inheritance_levels", 3)
                        .useCase("Add responsibilities dynamically without inheritance")
                        .useCase("Multiple feature combinations - avoid class explosion")
                        .useCase("Transparent enhancement - client doesn't know about decoration")
                        .useCase("Composable behaviors - stack multiple decorators")
                        .benefits(List.of("More flexible than inheritance", "Adds responsibilities at runtime",
                                "Supports composition of behaviors", "Follows single responsibility principle"))
                        .build())
                .whenNotToUse(AntiPatternCriteria.builder()
                        .redFlags(List.of("component interface too complex", "fixed combinations",
                                "performance critical", "simple objects"))
                        .scenarioToAvoid("Component interface is too complex - decorators must implement every method")
                        .scenarioToAvoid("Fixed set of combinations - regular inheritance might be simpler")
                        .scenarioToAvoid("Performance critical - each decorator adds an indirection layer")
                        .scenarioToAvoid("Simple objects - don't over-engineer basic data")
                        .betterAlternatives(List.of("Inheritance for fixed combinations",
                                "Composition for simple wrapping",
                                "Default interface methods for shared behavior",
                                "Strategy pattern for algorithmic variations"))
                        .commonMistakes(List.of("Making decorators too complex",
                                "Not maintaining component interface properly",
                                "Using for simple feature additions"))
                        .build())
                .advanced(AdvancedScenarios.builder()
                        .threadingConsiderations("Decorators inherit the component's thread-safety; nested state may need coordinated locking")
                        .performanceImplications("Each layer adds a call; deep nesting adds memory")
                        .testingChallenges("Test each decorator alone and in stacked combinations")
                        .optimizationTips("Valuable from three optional features upward")
                        .enterpriseConsiderations("Document composition and ordering rules")
                        .build())
                .alternatives(List.of("Inheritance hierarchies", "Composition", "Default interface methods",
                        "Aspect-oriented programming"))
                .complexityScore(7)
                .learningDifficulty(6)
                .build();
    }

    private static PatternKnowledge state() {
        return PatternKnowledge.builder()
                .key(STATE)
                .name("State Pattern")
                .category(PatternCategory.BEHAVIORAL)
                .description("Allows object to alter behavior when internal state changes")
                .whenToUse(PatternCriteria.builder()
                        .minimumComplexity(ComplexityLevel.MODERATE)
                        .indicators(List.of("behavior depends on state", "finite state machine", "state transitions",
                                "workflow", "different behavior", "state-dependent"))
                        .threshold("states", 3)
                        .threshold("state_transitions", 3)
                        .threshold("behavior_differences", 5)
                        .useCase("Behavior depends on object state (game character abilities)")
                        .useCase("Complex conditionals based on state - replace if/else chains")
                        .useCase("Finite state machines - clear states and transitions")
                        .useCase("Workflow systems - document approval, order processing")
                        .benefits(List.of("Eliminates complex conditional statements",
                                "Makes state transitions explicit", "Easy to add new states",
                                "Each state encapsulates its behavior"))
                        .build())
                .whenNotToUse(AntiPatternCriteria.builder()
                        .redFlags(List.of("few states", "simple behavior", "rare state changes", "simple logic",
                                "performance critical"))
                        .scenarioToAvoid("Few states with simple behavior - an enum with a switch might be simpler")
                        .scenarioToAvoid("Rare state changes - overhead not justified")
                        .scenarioToAvoid("Simple logic - don't over-engineer basic conditionals")
                        .scenarioToAvoid("Performance critical - state objects add overhead")
                        .betterAlternatives(List.of("Enum with switch for simple states",
                                "Strategy pattern for algorithmic variations",
                                "Boolean flags for binary states",
                                "Command pattern for action-based behavior"))
                        .commonMistakes(List.of("Using for simple boolean states",
                                "Not handling all state transitions properly", "Making states too granular"))
                        .build())
                .advanced(AdvancedScenarios.builder()
                        .threadingConsiderations("State transitions must be atomic under concurrency")
                        .performanceImplications("Share stateless state objects instead of allocating per transition")
                        .testingChallenges("Test each state, every transition and invalid transitions")
                        .optimizationTips("Use from three states with distinct behavior upward")
                        .enterpriseConsiderations("Document the state machine; plan for persistence and restoration")
                        .build())
                .alternatives(List.of("Enum with switch", "Strategy pattern", "Boolean flags",
                        "State machine libraries"))
                .complexityScore(7)
                .learningDifficulty(6)
                .build();
    }

    private static PatternKnowledge repository() {
        return PatternKnowledge.builder()
                .key(REPOSITORY)
                .name("Repository Pattern")
                .category(PatternCategory.BEHAVIORAL)
                .description("Centralizes data access logic and provides uniform interface")
                .whenToUse(PatternCriteria.builder()
                        .minimumComplexity(ComplexityLevel.MODERATE)
                        .indicators(List.of("data access", "multiple data sources", "testability", "domain logic",
                                "centralize queries", "abstract storage"))
                        .threshold("data_sources", 1)
                        .threshold("complex_queries", 3)
                        .threshold("entities", 2)
                        .threshold("data_access_calls", 2)
                        .useCase("Centralizing data access logic across application")
                        .useCase("Supporting multiple data sources (database, file, API)")
                        .useCase("Improving testability by abstracting data layer")
                        .useCase("Domain-driven design - isolate domain from infrastructure")
                        .benefits(List.of("Centralizes data access logic", "Easy to switch data sources",
                                "Improves testability with mock repositories",
                                "Separates domain logic from data access"))
                        .build())
                .whenNotToUse(AntiPatternCriteria.builder()
                        .redFlags(List.of("simple applications", "ORM already provides abstraction",
                                "unjustified overhead", "single data source"))
                        .scenarioToAvoid("Simple applications - CRUD operations don't need a repository layer")
                        .scenarioToAvoid("ORM already provides abstraction - don't add another layer")
                        .scenarioToAvoid("Unjustified overhead - repositories add complexity")
                        .scenarioToAvoid("Single data source with no switching plans")
                        .betterAlternatives(List.of("Direct ORM usage for simple applications",
                                "Data Access Objects (DAO) for simple CRUD",
                                "Active Record pattern for simple models",
                                "Query builders for dynamic queries"))
                        .commonMistakes(List.of("Making repository too generic (generic repository anti-pattern)",
                                "Putting business logic in repository",
                                "Not using Unit of Work pattern with repositories"))
                        .build())
                .advanced(AdvancedScenarios.builder()
                        .threadingConsiderations("Repository implementations must be thread-safe; pool connections")
                        .performanceImplications("Cache inside the repository; prefer bulk operations")
                        .testingChallenges("Mock repositories in unit tests; integration-test real data sources")
                        .optimizationTips("Pair with Unit of Work for transaction management")
                        .enterpriseConsiderations("Document repository contracts; plan for eventual consistency")
                        .build())
                .alternatives(List.of("Direct ORM usage", "Data Access Objects (DAO)", "Active Record pattern",
                        "Query builders"))
                .complexityScore(6)
                .learningDifficulty(5)
                .build();
    }
}
